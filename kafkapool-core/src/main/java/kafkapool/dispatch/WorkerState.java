package kafkapool.dispatch;

/**
 * Lifecycle of a {@link PublishWorker}.
 */
public enum WorkerState {
  /** Created, not yet running or waiting for the broker connection. */
  STARTING,
  /** Taking a batch from the work queue. */
  DRAINING,
  /** Queue was empty; waiting for the idle sleep to pass. */
  IDLE,
  /** Processing a drained batch, including retry sleeps. */
  PUBLISHING,
  /** Observed a shutdown message and is finishing the current batch. */
  SHUTTING_DOWN,
  /** Exited its loop; will not process more messages. */
  TERMINATED
}
