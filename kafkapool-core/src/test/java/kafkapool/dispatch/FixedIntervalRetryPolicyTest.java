package kafkapool.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FixedIntervalRetryPolicyTest {

  @Test
  void everyRetryWaitsTheSameInterval() {
    FixedIntervalRetryPolicy policy = new FixedIntervalRetryPolicy(1000);

    assertEquals(1000L, policy.computeDelayMs(1));
    assertEquals(1000L, policy.computeDelayMs(2));
    assertEquals(1000L, policy.computeDelayMs(500));
  }

  @Test
  void noDelayBeforeFirstFailure() {
    assertEquals(0L, new FixedIntervalRetryPolicy(1000).computeDelayMs(0));
  }

  @Test
  void rejectsNegativeInterval() {
    assertThrows(IllegalArgumentException.class, () -> new FixedIntervalRetryPolicy(-1));
  }
}
