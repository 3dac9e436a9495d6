package kafkapool.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy that doubles the delay after every failed publish, with jitter.
 *
 * <p>Delay: {@code baseDelay * 2^(attempt-1)} capped at {@code maxDelay}, then scaled by a
 * random factor in [0.5, 1.5) and capped again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private static final int MAX_SHIFT = 30;

  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  upper bound for any delay (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    int shift = Math.min(attempts - 1, MAX_SHIFT);
    long factor = 1L << shift;
    long uncapped = factor > maxDelayMs / baseDelayMs ? maxDelayMs : baseDelayMs * factor;
    long capped = Math.min(maxDelayMs, uncapped);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, (long) (capped * jitter));
  }
}
