package kafkapool.queue;

/**
 * Thrown when {@link WorkQueue#enqueue} is called with no messages. The queue is unchanged.
 */
public final class EmptyBatchException extends WorkQueueException {

  public EmptyBatchException() {
    super("no msgs to add");
  }
}
