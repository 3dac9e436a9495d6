package kafkapool.dispatch;

/**
 * Strategy for computing the delay before a worker retries a failed publish.
 *
 * @see FixedIntervalRetryPolicy
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next publish attempt.
     *
     * @param attempts the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
