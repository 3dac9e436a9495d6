/**
 * The shared, lock-protected work queue that decouples producers from publishing workers.
 *
 * @see kafkapool.queue.WorkQueue
 */
package kafkapool.queue;
