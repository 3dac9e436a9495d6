/**
 * Worker pool that drains the shared queue and publishes through per-worker broker clients.
 *
 * <p>{@link kafkapool.dispatch.WorkerPool} starts one {@link kafkapool.dispatch.PublishWorker}
 * per configured thread. Failed publishes are retried according to a
 * {@link kafkapool.dispatch.RetryPolicy}; workers exit cooperatively on a shutdown message.
 *
 * @see kafkapool.dispatch.WorkerPool
 * @see kafkapool.dispatch.PublishWorker
 * @see kafkapool.dispatch.RetryPolicy
 */
package kafkapool.dispatch;
