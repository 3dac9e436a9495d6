package kafkapool;

import kafkapool.config.PoolConfig;
import kafkapool.dispatch.WorkerPool;
import kafkapool.metadata.MetadataQuery;
import kafkapool.metadata.MetadataReport;
import kafkapool.queue.WorkQueue;
import kafkapool.queue.WorkQueueException;
import kafkapool.spi.BrokerClient;
import kafkapool.spi.BrokerClientFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Caller-side handle of a running pool: enqueues messages for the workers, requests shutdown
 * and runs metadata queries.
 *
 * <p>Enqueue operations return as soon as the messages are in the shared queue; publishing
 * happens asynchronously on the pool threads. When the configuration is disabled every
 * operation is a no-op.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (KafkaPublisher publisher = KafkaThreadpool.start(config, new KafkaBrokerClientFactory())) {
 *   publisher.addDataMsg("testing", "key-1", Map.of(), "{\"id\":1}");
 *   publisher.shutdown();
 *   publisher.awaitTermination(Duration.ofSeconds(10));
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see KafkaThreadpool
 */
public final class KafkaPublisher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(KafkaPublisher.class.getName());

  static final String SHUTDOWN_STARTED = "shutdown started";
  static final String NOT_ENABLED = "kafka not enabled";

  private final PoolConfig config;
  private final WorkerPool pool;
  private final BrokerClientFactory clientFactory;

  KafkaPublisher(PoolConfig config, WorkerPool pool, BrokerClientFactory clientFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
  }

  public PoolConfig config() {
    return config;
  }

  public WorkQueue queue() {
    return pool.queue();
  }

  public WorkerPool pool() {
    return pool;
  }

  /**
   * Builds a {@link MessageKind#DATA} message and enqueues it.
   *
   * @param topic   destination topic
   * @param key     partition key
   * @param headers record headers, may be {@code null}
   * @param payload message body
   * @return queue length after the append, or {@code 0} when disabled
   * @throws WorkQueueException if the queue rejects the message
   */
  public int addDataMsg(String topic, String key, Map<String, String> headers, String payload)
      throws WorkQueueException {
    if (!config.isEnabled()) {
      return 0;
    }
    return pool.queue().enqueue(List.of(PublishMessage.data(topic, key, headers, payload)));
  }

  /**
   * Enqueues a caller-built message.
   *
   * @param message message of any kind
   * @return queue length after the append, or {@code 0} when disabled
   * @throws WorkQueueException if the queue rejects the message
   */
  public int addMsg(PublishMessage message) throws WorkQueueException {
    Objects.requireNonNull(message, "message");
    if (!config.isEnabled()) {
      return 0;
    }
    return pool.queue().enqueue(List.of(message));
  }

  /**
   * Enqueues caller-built messages atomically and in order.
   *
   * @param messages messages to append, must not be empty
   * @return queue length after the append, or {@code 0} when disabled
   * @throws WorkQueueException if {@code messages} is empty or the queue rejects them
   */
  public int addMsgs(List<PublishMessage> messages) throws WorkQueueException {
    if (!config.isEnabled()) {
      return 0;
    }
    return pool.queue().enqueue(messages);
  }

  /**
   * Removes every queued message without publishing it.
   *
   * @return the drained messages in queue order, empty when kafka is not enabled
   */
  public List<PublishMessage> drainMsgs() {
    if (!config.isEnabled()) {
      return List.of();
    }
    return pool.queue().drainAll();
  }

  /**
   * Enqueues one shutdown message, wakes idle workers and returns without waiting for them.
   *
   * @return {@code "shutdown started"}, or {@code "kafka not enabled"} when disabled
   * @throws WorkQueueException if the shutdown message cannot be enqueued
   */
  public String shutdown() throws WorkQueueException {
    if (!config.isEnabled()) {
      logger.info(config.label() + " - " + NOT_ENABLED);
      return NOT_ENABLED;
    }
    int total = pool.queue().enqueue(List.of(PublishMessage.shutdown()));
    pool.requestShutdown();
    logger.info(config.label() + " - " + SHUTDOWN_STARTED + " queued=" + total);
    return SHUTDOWN_STARTED;
  }

  /**
   * Opens a dedicated broker connection, logs the cluster layout and closes the connection.
   *
   * @param fetchOffsets whether to estimate message counts from watermark offsets
   * @param topic        topic to describe, or {@code null} for all topics
   * @return the report, or {@link MetadataReport#EMPTY} when disabled
   * @throws kafkapool.spi.BrokerClientException if connecting or fetching fails
   */
  public MetadataReport getMetadata(boolean fetchOffsets, String topic) {
    if (!config.isEnabled()) {
      logger.info(config.label() + " - " + NOT_ENABLED + " - skipping metadata");
      return MetadataReport.EMPTY;
    }
    try (BrokerClient client = clientFactory.connect(config.brokerList(), config.tls())) {
      return new MetadataQuery(config.label()).run(client, fetchOffsets, topic);
    }
  }

  /**
   * Waits until every worker has exited, typically after {@link #shutdown()}.
   *
   * @param timeout maximum time to wait
   * @return {@code true} if all workers exited in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return pool.awaitTermination(timeout);
  }

  /** Stops the pool, see {@link WorkerPool#close()}. */
  @Override
  public void close() {
    pool.close();
  }
}
