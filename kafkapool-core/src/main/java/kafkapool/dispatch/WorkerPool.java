package kafkapool.dispatch;

import kafkapool.config.PoolConfig;
import kafkapool.queue.WorkQueue;
import kafkapool.spi.BrokerClientFactory;
import kafkapool.spi.MetricsExporter;
import kafkapool.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of {@link PublishWorker}s draining one shared {@link WorkQueue}.
 *
 * <p>The constructor starts {@code config.numThreads()} workers immediately and returns
 * without waiting for them to connect. Each worker gets the shared queue and the same
 * immutable {@link PoolConfig}. A disabled configuration, or one with zero threads, starts
 * no workers: queued messages then stay in the queue.
 *
 * <p>Workers stop cooperatively once they observe a shutdown message (see
 * {@link kafkapool.MessageKind#SHUTDOWN}); {@link #awaitTermination(Duration)} waits for that.
 * {@link #close()} additionally trips the shutdown signal and, after the drain timeout,
 * interrupts workers that are still running.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  private final PoolConfig config;
  private final WorkQueue queue;
  private final MetricsExporter metrics;
  private final ShutdownSignal shutdownSignal = new ShutdownSignal();
  private final List<PublishWorker> workers;
  private final ExecutorService executor;
  private final CountDownLatch exited;
  private final AtomicInteger live;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final long drainTimeoutMs;

  private WorkerPool(Builder builder) {
    this.config = Objects.requireNonNull(builder.config, "config");
    BrokerClientFactory clientFactory = Objects.requireNonNull(builder.clientFactory, "clientFactory");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.queue = builder.queue != null ? builder.queue : new WorkQueue(metrics);
    RetryPolicy retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new FixedIntervalRetryPolicy(config.retrySleep().toMillis());
    this.drainTimeoutMs = builder.drainTimeoutMs;

    if (builder.maxPublishAttempts < 0) {
      throw new IllegalArgumentException("maxPublishAttempts must be >= 0");
    }
    if (builder.batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1");
    }
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }

    int workerCount = config.isEnabled() ? config.numThreads() : 0;
    this.exited = new CountDownLatch(workerCount);
    this.live = new AtomicInteger(workerCount);

    List<PublishWorker> created = new ArrayList<>(workerCount);
    for (int i = 0; i < workerCount; i++) {
      created.add(new PublishWorker(i, config, queue, clientFactory, retryPolicy,
          builder.maxPublishAttempts, builder.batchSize, shutdownSignal, metrics, this::onWorkerExit));
    }
    this.workers = Collections.unmodifiableList(created);

    if (workerCount > 0) {
      logger.info(config.label() + " - starting threads=" + workerCount);
      this.executor = Executors.newFixedThreadPool(workerCount,
          new DaemonThreadFactory(config.label() + "-worker-"));
      metrics.recordLiveWorkers(workerCount);
      for (PublishWorker worker : workers) {
        logger.fine(config.label() + " - creating thread=" + worker.index());
        executor.submit(worker);
      }
    } else {
      if (config.isEnabled()) {
        logger.warning(config.label() + " - numThreads=0: no publish workers started; messages will not be published");
      } else {
        logger.info(config.label() + " - kafka not enabled: no publish workers started");
      }
      this.executor = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  private synchronized void onWorkerExit() {
    metrics.recordLiveWorkers(live.decrementAndGet());
    exited.countDown();
  }

  public PoolConfig config() {
    return config;
  }

  public WorkQueue queue() {
    return queue;
  }

  public List<PublishWorker> workers() {
    return workers;
  }

  /**
   * @return number of workers that have not exited yet
   */
  public int liveWorkers() {
    return live.get();
  }

  /**
   * Waits until every worker has exited.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if all workers exited, {@code false} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Wakes idle workers so they drain a queued shutdown message without waiting out their idle
   * sleep. Workers still publish everything queued ahead of it before exiting.
   */
  public void requestShutdown() {
    shutdownSignal.trip();
  }

  /**
   * Trips the shutdown signal so idle workers exit once the queue is empty, waits up to the
   * drain timeout, then interrupts the remaining workers. Messages still queued are left in
   * the queue.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    shutdownSignal.trip();
    if (executor == null) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, config.label() + " - drain timeout exceeded; forcing shutdown. "
            + "Live workers: " + live.get() + ", queued: " + queue.size());
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link WorkerPool}. */
  public static final class Builder {
    private PoolConfig config;
    private BrokerClientFactory clientFactory;
    private WorkQueue queue;
    private RetryPolicy retryPolicy;
    private int maxPublishAttempts = 0;
    private int batchSize = WorkQueue.DEFAULT_BATCH_SIZE;
    private MetricsExporter metrics;
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the pool configuration.
     *
     * <p><b>Required.</b>
     *
     * @param config the configuration shared by all workers
     * @return this builder
     */
    public Builder config(PoolConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the factory each worker uses to open its own broker connection.
     *
     * <p><b>Required.</b>
     *
     * @param clientFactory the broker client factory
     * @return this builder
     */
    public Builder clientFactory(BrokerClientFactory clientFactory) {
      this.clientFactory = clientFactory;
      return this;
    }

    /**
     * Sets the shared queue.
     *
     * <p>Optional. Defaults to a new {@link WorkQueue} reporting to the configured metrics.
     *
     * @param queue the work queue
     * @return this builder
     */
    public Builder queue(WorkQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Sets the policy that computes the delay before re-publishing a failed message.
     *
     * <p>Optional. Defaults to {@link FixedIntervalRetryPolicy} with the configured retry sleep.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the maximum number of publish attempts per message.
     *
     * <p>Optional. Defaults to {@code 0}, meaning retry forever. A message that reaches the
     * limit is dropped and reported as {@link DropReason#RETRIES_EXHAUSTED}.
     *
     * @param maxPublishAttempts attempts per message, or {@code 0} for unlimited
     * @return this builder
     */
    public Builder maxPublishAttempts(int maxPublishAttempts) {
      this.maxPublishAttempts = maxPublishAttempts;
      return this;
    }

    /**
     * Sets how many messages a worker drains at once.
     *
     * <p>Optional. Defaults to {@value WorkQueue#DEFAULT_BATCH_SIZE}.
     *
     * @param batchSize maximum drain size
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets how long {@link WorkerPool#close()} waits for workers before interrupting them.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the pool. Workers begin draining immediately.
     *
     * @return a running pool
     * @throws NullPointerException if {@code config} or {@code clientFactory} is null
     * @throws IllegalArgumentException if {@code maxPublishAttempts < 0}, {@code batchSize < 1}
     *     or {@code drainTimeoutMs < 0}
     */
    public WorkerPool build() {
      return new WorkerPool(this);
    }
  }
}
