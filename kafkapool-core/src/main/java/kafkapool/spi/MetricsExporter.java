package kafkapool.spi;

import kafkapool.dispatch.DropReason;

/**
 * Observability hook for exporting pool counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Implementations are
 * called from worker threads and must be thread-safe.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Adds to the count of messages appended to the work queue.
     *
     * @param count number of messages appended by one enqueue call
     */
    void incrementEnqueued(int count);

    /**
     * Increments the count of messages published successfully.
     */
    void incrementPublishSuccess();

    /**
     * Increments the count of publish attempts that returned a non-zero status.
     */
    void incrementPublishFailure();

    /**
     * Adds to the count of messages a worker discarded without publishing.
     *
     * @param reason why the messages were discarded
     * @param count  number of discarded messages
     */
    void incrementDropped(DropReason reason, int count);

    /**
     * Records the current number of pending messages in the work queue.
     *
     * @param depth queue length after the last enqueue or drain
     */
    void recordQueueDepth(int depth);

    /**
     * Records the number of workers that have not exited yet.
     *
     * @param live running workers
     */
    default void recordLiveWorkers(int live) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued(int count) {
        }

        @Override
        public void incrementPublishSuccess() {
        }

        @Override
        public void incrementPublishFailure() {
        }

        @Override
        public void incrementDropped(DropReason reason, int count) {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
