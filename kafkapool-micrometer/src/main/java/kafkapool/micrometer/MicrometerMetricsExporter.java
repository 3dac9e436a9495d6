package kafkapool.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import kafkapool.dispatch.DropReason;
import kafkapool.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code kafkapool.enqueue}: messages appended to the work queue</li>
 *   <li>{@code kafkapool.publish.success}: messages acknowledged by the broker</li>
 *   <li>{@code kafkapool.publish.failure}: failed publish attempts (retried)</li>
 *   <li>{@code kafkapool.dropped}: messages discarded by a worker, tagged with {@code reason}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code kafkapool.queue.depth}: pending messages</li>
 *   <li>{@code kafkapool.workers.live}: workers that have not exited</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter enqueued;
  private final Counter publishSuccess;
  private final Counter publishFailure;
  private final Map<DropReason, Counter> dropped = new EnumMap<>(DropReason.class);
  private final Gauge queueDepthGauge;
  private final Gauge liveWorkersGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private final AtomicInteger liveWorkers = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "kafkapool"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "kafkapool");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.kafkapool"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.enqueued = Counter.builder(namePrefix + ".enqueue")
        .description("Messages appended to the work queue")
        .register(registry);
    this.publishSuccess = Counter.builder(namePrefix + ".publish.success")
        .description("Messages acknowledged by the broker")
        .register(registry);
    this.publishFailure = Counter.builder(namePrefix + ".publish.failure")
        .description("Failed publish attempts (will retry)")
        .register(registry);
    for (DropReason reason : DropReason.values()) {
      dropped.put(reason, Counter.builder(namePrefix + ".dropped")
          .description("Messages discarded without publishing")
          .tag("reason", reason.name())
          .register(registry));
    }

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.liveWorkersGauge = Gauge.builder(namePrefix + ".workers.live", liveWorkers, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementEnqueued(int count) {
    if (closed) return;
    enqueued.increment(count);
  }

  @Override
  public void incrementPublishSuccess() {
    if (closed) return;
    publishSuccess.increment();
  }

  @Override
  public void incrementPublishFailure() {
    if (closed) return;
    publishFailure.increment();
  }

  @Override
  public void incrementDropped(DropReason reason, int count) {
    if (closed) return;
    dropped.get(reason).increment(count);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordLiveWorkers(int live) {
    if (closed) return;
    liveWorkers.set(live);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(enqueued, publishSuccess, publishFailure,
        queueDepthGauge, liveWorkersGauge));
    meters.addAll(dropped.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
