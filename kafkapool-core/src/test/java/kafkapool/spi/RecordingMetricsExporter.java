package kafkapool.spi;

import kafkapool.dispatch.DropReason;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MetricsExporter that keeps every value in memory for assertions.
 */
public class RecordingMetricsExporter implements MetricsExporter {
  public final AtomicInteger enqueued = new AtomicInteger();
  public final AtomicInteger publishSuccess = new AtomicInteger();
  public final AtomicInteger publishFailure = new AtomicInteger();
  public final Map<DropReason, AtomicInteger> dropped = new ConcurrentHashMap<>();
  public final AtomicInteger queueDepth = new AtomicInteger(-1);
  public final AtomicInteger liveWorkers = new AtomicInteger(-1);

  @Override
  public void incrementEnqueued(int count) {
    enqueued.addAndGet(count);
  }

  @Override
  public void incrementPublishSuccess() {
    publishSuccess.incrementAndGet();
  }

  @Override
  public void incrementPublishFailure() {
    publishFailure.incrementAndGet();
  }

  @Override
  public void incrementDropped(DropReason reason, int count) {
    dropped.computeIfAbsent(reason, r -> new AtomicInteger()).addAndGet(count);
  }

  @Override
  public void recordQueueDepth(int depth) {
    queueDepth.set(depth);
  }

  @Override
  public void recordLiveWorkers(int live) {
    liveWorkers.set(live);
  }

  public int dropped(DropReason reason) {
    AtomicInteger count = dropped.get(reason);
    return count == null ? 0 : count.get();
  }
}
