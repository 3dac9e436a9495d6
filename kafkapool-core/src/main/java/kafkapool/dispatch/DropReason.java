package kafkapool.dispatch;

/**
 * Why a worker discarded messages without publishing them.
 *
 * <p>Every path on which a drained message is lost is reported through
 * {@link kafkapool.spi.MetricsExporter#incrementDropped(DropReason, int)} so it can be
 * detected and alerted on.
 */
public enum DropReason {
  /** A message kind the worker has no handler for; the rest of the local batch is discarded. */
  UNSUPPORTED_KIND,
  /** A reserved message kind ({@code LOG_BROKER_*}); the rest of the local batch is discarded. */
  NOT_IMPLEMENTED,
  /** Messages drained in the same batch after a shutdown message. */
  SHUTDOWN_REMAINDER,
  /** A bounded retry policy gave up on the message. */
  RETRIES_EXHAUSTED,
  /** A worker failed mid-batch and its unpublished messages could not be put back on the queue. */
  WORKER_FAILURE
}
