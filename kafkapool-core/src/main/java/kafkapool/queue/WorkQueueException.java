package kafkapool.queue;

/**
 * Base type for failures reported by {@link WorkQueue#enqueue}.
 */
public class WorkQueueException extends Exception {

  public WorkQueueException(String message) {
    super(message);
  }

  public WorkQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
