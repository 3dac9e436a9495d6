package kafkapool;

import kafkapool.config.EnvironmentConfigLoader;
import kafkapool.config.PoolConfig;
import kafkapool.dispatch.RetryPolicy;
import kafkapool.dispatch.WorkerPool;
import kafkapool.queue.WorkQueue;
import kafkapool.spi.BrokerClientFactory;
import kafkapool.spi.MetricsExporter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point that starts a {@link WorkerPool} and wraps it in a {@link KafkaPublisher}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * KafkaPublisher publisher = KafkaThreadpool.builder()
 *     .config(PoolConfig.builder("orders").broker("localhost:9092").build())
 *     .clientFactory(new KafkaBrokerClientFactory())
 *     .retryPolicy(new ExponentialBackoffRetryPolicy(200, 10_000))
 *     .maxPublishAttempts(20)
 *     .start();
 * }</pre>
 */
public final class KafkaThreadpool {

  private KafkaThreadpool() {}

  /**
   * Starts a pool with default retry, batch and metrics settings.
   *
   * @param config        pool configuration
   * @param clientFactory factory for per-worker broker connections
   * @return the publisher handle; workers are already running
   */
  public static KafkaPublisher start(PoolConfig config, BrokerClientFactory clientFactory) {
    return builder().config(config).clientFactory(clientFactory).start();
  }

  /**
   * Starts a pool configured from the {@code KAFKA_*} environment variables.
   *
   * @param label         tracking label, or {@code null} to use {@code KAFKA_LOG_LABEL}
   * @param clientFactory factory for per-worker broker connections
   * @return the publisher handle
   * @throws IllegalArgumentException if an environment variable holds an invalid value
   */
  public static KafkaPublisher startFromEnvironment(String label, BrokerClientFactory clientFactory) {
    return start(EnvironmentConfigLoader.fromEnvironment(label), clientFactory);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for a started pool. A builder can be used once. */
  public static final class Builder {
    private PoolConfig config;
    private BrokerClientFactory clientFactory;
    private WorkQueue queue;
    private RetryPolicy retryPolicy;
    private MetricsExporter metrics;
    private int maxPublishAttempts = 0;
    private int batchSize = WorkQueue.DEFAULT_BATCH_SIZE;
    private long drainTimeoutMs = 5000;
    private final AtomicBoolean started = new AtomicBoolean(false);

    private Builder() {}

    public Builder config(PoolConfig config) {
      this.config = config;
      return this;
    }

    public Builder clientFactory(BrokerClientFactory clientFactory) {
      this.clientFactory = clientFactory;
      return this;
    }

    public Builder queue(WorkQueue queue) {
      this.queue = queue;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @param maxPublishAttempts attempts per message before it is dropped, {@code 0} for unlimited
     */
    public Builder maxPublishAttempts(int maxPublishAttempts) {
      this.maxPublishAttempts = maxPublishAttempts;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Starts the workers and returns the publisher handle.
     *
     * @return the publisher handle
     * @throws IllegalStateException if called twice on the same builder
     */
    public KafkaPublisher start() {
      if (!started.compareAndSet(false, true)) {
        throw new IllegalStateException("start() already called on this builder");
      }
      Objects.requireNonNull(config, "config");
      Objects.requireNonNull(clientFactory, "clientFactory");
      WorkerPool pool = WorkerPool.builder()
          .config(config)
          .clientFactory(clientFactory)
          .queue(queue)
          .retryPolicy(retryPolicy)
          .metrics(metrics)
          .maxPublishAttempts(maxPublishAttempts)
          .batchSize(batchSize)
          .drainTimeoutMs(drainTimeoutMs)
          .build();
      return new KafkaPublisher(config, pool, clientFactory);
    }
  }
}
