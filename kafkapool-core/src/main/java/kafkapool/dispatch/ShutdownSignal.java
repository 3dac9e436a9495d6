package kafkapool.dispatch;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Pool-wide latch tripped once a worker has observed a shutdown message, or the pool is
 * closed. Idle workers wait on it instead of sleeping, so they notice shutdown right away.
 */
final class ShutdownSignal {
  private final CountDownLatch tripped = new CountDownLatch(1);

  void trip() {
    tripped.countDown();
  }

  boolean isTripped() {
    return tripped.getCount() == 0;
  }

  /**
   * Waits until the signal trips or the timeout passes.
   *
   * @return {@code true} if the signal tripped
   */
  boolean await(Duration timeout) throws InterruptedException {
    return tripped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }
}
