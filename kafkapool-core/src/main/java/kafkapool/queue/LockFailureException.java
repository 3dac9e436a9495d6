package kafkapool.queue;

/**
 * Thrown when the queue lock cannot be used: the waiting thread was interrupted, or an
 * earlier holder failed inside the critical section and left the queue poisoned.
 */
public final class LockFailureException extends WorkQueueException {

  public LockFailureException(String message) {
    super(message);
  }

  public LockFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
