package kafkapool.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstRetryIsAroundBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(200, 10_000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 100 && delay < 300, "got: " + delay);
  }

  @Test
  void delayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1_000_000);

    long third = policy.computeDelayMs(3);
    long fifth = policy.computeDelayMs(5);

    // 400 and 1600 before jitter
    assertTrue(third >= 200 && third < 600, "third: " + third);
    assertTrue(fifth >= 800 && fifth < 2400, "fifth: " + fifth);
  }

  @Test
  void neverExceedsMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int attempt = 1; attempt < 50; attempt++) {
      long delay = policy.computeDelayMs(attempt);
      assertTrue(delay <= 500, "attempt " + attempt + ": " + delay);
    }
  }

  @Test
  void largeAttemptCountsDoNotOverflow() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60_000);

    assertTrue(policy.computeDelayMs(31) > 0);
    assertTrue(policy.computeDelayMs(Integer.MAX_VALUE) > 0);
  }

  @Test
  void noDelayBeforeFirstFailure() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10_000);

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void rejectsInvalidBounds() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50));
  }
}
