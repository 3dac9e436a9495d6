package kafkapool.dispatch;

/**
 * Retry policy that waits the same interval before every attempt. This is the pool's
 * default, using the configured retry sleep.
 */
public final class FixedIntervalRetryPolicy implements RetryPolicy {
  private final long intervalMs;

  public FixedIntervalRetryPolicy(long intervalMs) {
    if (intervalMs < 0) {
      throw new IllegalArgumentException("intervalMs must be >= 0, got: " + intervalMs);
    }
    this.intervalMs = intervalMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    return attempts <= 0 ? 0L : intervalMs;
  }

  public long intervalMs() {
    return intervalMs;
  }
}
