package kafkapool.dispatch;

import kafkapool.MessageKind;
import kafkapool.PublishMessage;
import kafkapool.config.PoolConfig;
import kafkapool.queue.WorkQueue;
import kafkapool.queue.WorkQueueException;
import kafkapool.spi.BrokerClient;
import kafkapool.spi.BrokerClientFactory;
import kafkapool.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One pool thread: drains batches from the shared {@link WorkQueue} and publishes them through
 * its own {@link BrokerClient}.
 *
 * <p>Per loop iteration the worker drains up to {@code batchSize} messages. An empty drain makes
 * it wait for the idle sleep. Otherwise the batch is processed front to back:
 * <ul>
 *   <li>{@code DATA} / {@code SENSITIVE}: published, retrying the same message after the retry
 *       policy's delay until the broker reports success (or a bounded attempt limit is hit)</li>
 *   <li>{@code SHUTDOWN}: a copy is put back on the queue so the remaining workers see it too,
 *       the pool's shutdown signal is tripped, and the worker exits after this batch</li>
 *   <li>{@code LOG_BROKER_*} and unknown kinds: logged, and the rest of the batch is discarded</li>
 * </ul>
 * Every discard is reported through {@link MetricsExporter#incrementDropped}.
 */
public final class PublishWorker implements Runnable {
  private static final Logger logger = Logger.getLogger(PublishWorker.class.getName());

  private static final int PAYLOAD_PREVIEW_CHARS = 10;
  private static final int PUBLISH_EXCEPTION_STATUS = -1;

  private final int index;
  private final String logLabel;
  private final PoolConfig config;
  private final WorkQueue queue;
  private final BrokerClientFactory clientFactory;
  private final RetryPolicy retryPolicy;
  private final int maxPublishAttempts;
  private final int batchSize;
  private final ShutdownSignal shutdownSignal;
  private final MetricsExporter metrics;
  private final Runnable onExit;
  private volatile WorkerState state = WorkerState.STARTING;

  PublishWorker(int index, PoolConfig config, WorkQueue queue, BrokerClientFactory clientFactory,
      RetryPolicy retryPolicy, int maxPublishAttempts, int batchSize, ShutdownSignal shutdownSignal,
      MetricsExporter metrics, Runnable onExit) {
    this.index = index;
    this.config = Objects.requireNonNull(config, "config");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.maxPublishAttempts = maxPublishAttempts;
    this.batchSize = batchSize;
    this.shutdownSignal = Objects.requireNonNull(shutdownSignal, "shutdownSignal");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.onExit = Objects.requireNonNull(onExit, "onExit");
    this.logLabel = config.label() + "-tid-" + (index + 1);
  }

  public int index() {
    return index;
  }

  public String logLabel() {
    return logLabel;
  }

  public WorkerState state() {
    return state;
  }

  @Override
  public void run() {
    try {
      BrokerClient client = connect();
      if (client == null) {
        return;
      }
      try (client) {
        processLoop(client);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.info(logLabel + " - interrupted");
      }
    } catch (RuntimeException | Error e) {
      logger.log(Level.SEVERE, logLabel + " - worker failed - stopping thread", e);
    } finally {
      state = WorkerState.TERMINATED;
      logger.info(logLabel + " - done exiting thread");
      onExit.run();
    }
  }

  private BrokerClient connect() {
    if (!config.hasBrokers()) {
      logger.severe(logLabel + " - no brokers to connect to brokers=" + config.brokerList()
          + " - stopping thread");
      return null;
    }
    if (index == 0) {
      logger.info("threadpool connecting to brokers=" + config.brokerList()
          + " topics=" + config.publishTopics()
          + " tls ca=" + config.tls().caPath()
          + " key=" + config.tls().keyPath()
          + " cert=" + config.tls().certPath()
          + " batch_size=" + batchSize);
    }
    try {
      return clientFactory.connect(config.brokerList(), config.tls());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, logLabel + " - failed to connect to brokers=" + config.brokerList()
          + " - stopping thread", e);
      return null;
    }
  }

  private void processLoop(BrokerClient client) throws InterruptedException {
    logger.fine(logLabel + " - start");
    while (!Thread.currentThread().isInterrupted()) {
      state = WorkerState.DRAINING;
      List<PublishMessage> batch = queue.drain(batchSize);
      if (batch.isEmpty()) {
        if (shutdownSignal.isTripped()) {
          logger.fine(logLabel + " - queue empty after shutdown");
          return;
        }
        state = WorkerState.IDLE;
        logger.finest(logLabel + " - idle");
        shutdownSignal.await(config.idleSleep());
        continue;
      }
      state = WorkerState.PUBLISHING;
      if (processBatch(client, batch)) {
        return;
      }
    }
  }

  /**
   * @return {@code true} if a shutdown message was seen and the worker must exit
   */
  private boolean processBatch(BrokerClient client, List<PublishMessage> batch) throws InterruptedException {
    logger.fine(logLabel + " - processing " + batch.size() + " msgs");
    int next = 0;
    boolean shouldShutdown = false;
    while (next < batch.size()) {
      PublishMessage msg = batch.get(next++);
      MessageKind kind = msg.kind();
      if (kind == MessageKind.SHUTDOWN) {
        shouldShutdown = true;
        state = WorkerState.SHUTTING_DOWN;
        requeueShutdown(msg);
        shutdownSignal.trip();
        break;
      } else if (kind.isPublishable()) {
        try {
          publish(client, msg);
        } catch (InterruptedException e) {
          requeueUnprocessed(batch.subList(next - 1, batch.size()), DropReason.SHUTDOWN_REMAINDER);
          throw e;
        } catch (RuntimeException | Error e) {
          requeueUnprocessed(batch.subList(next - 1, batch.size()), DropReason.WORKER_FAILURE);
          throw e;
        }
      } else if (kind == MessageKind.LOG_BROKER_DETAILS || kind == MessageKind.LOG_BROKER_TOPIC_DETAILS) {
        logger.info(logLabel + " not supported yet - type=" + kind + " - coming soon");
        reportDropped(DropReason.NOT_IMPLEMENTED, batch.size() - next + 1);
        break;
      } else {
        logger.severe(logLabel + " - unsupported message kind=" + kind);
        reportDropped(DropReason.UNSUPPORTED_KIND, batch.size() - next + 1);
        break;
      }
    }

    if (shouldShutdown) {
      int numLeft = batch.size() - next;
      if (numLeft == 0) {
        logger.fine(logLabel + " - work batch empty");
      } else {
        logger.severe(logLabel + " - work batch NOT empty=" + numLeft);
        reportDropped(DropReason.SHUTDOWN_REMAINDER, numLeft);
      }
      return true;
    }
    return false;
  }

  private void publish(BrokerClient client, PublishMessage msg) throws InterruptedException {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(logLabel + " pub topic=" + msg.topic() + " data='" + preview(msg) + "'");
    }
    byte[] payload = msg.payloadBytes();
    int attempts = 0;
    while (true) {
      int status = send(client, msg, payload);
      if (status == BrokerClient.SUCCESS) {
        metrics.incrementPublishSuccess();
        logger.fine(logLabel + " - published message topic=" + msg.topic());
        return;
      }
      attempts++;
      metrics.incrementPublishFailure();
      logger.warning(logLabel + " - failed to publish delivery status=" + status
          + " attempt=" + attempts + " retrying msg=" + msg);
      if (maxPublishAttempts > 0 && attempts >= maxPublishAttempts) {
        logger.severe(logLabel + " - giving up on msg id=" + msg.messageId()
            + " after " + attempts + " attempts");
        reportDropped(DropReason.RETRIES_EXHAUSTED, 1);
        return;
      }
      Thread.sleep(retryPolicy.computeDelayMs(attempts));
    }
  }

  private int send(BrokerClient client, PublishMessage msg, byte[] payload) {
    try {
      return client.publish(msg.topic(), msg.key(), msg.headers(), payload, System.currentTimeMillis());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, logLabel + " - publish failed for msg id=" + msg.messageId(), e);
      return PUBLISH_EXCEPTION_STATUS;
    }
  }

  private void requeueShutdown(PublishMessage msg) {
    try {
      int total = queue.enqueue(List.of(msg.copy()));
      logger.fine(logLabel + " - requeue shutdown message success with total in queue=" + total);
    } catch (WorkQueueException e) {
      logger.log(Level.SEVERE, logLabel + " - failed to requeue shutdown message", e);
    }
  }

  private void requeueUnprocessed(List<PublishMessage> unprocessed, DropReason reasonIfLost) {
    try {
      queue.enqueue(new ArrayList<>(unprocessed));
      logger.info(logLabel + " - requeued " + unprocessed.size() + " unprocessed msgs");
    } catch (WorkQueueException e) {
      logger.log(Level.SEVERE, logLabel + " - failed to requeue " + unprocessed.size()
          + " unprocessed msgs", e);
      reportDropped(reasonIfLost, unprocessed.size());
    }
  }

  private void reportDropped(DropReason reason, int count) {
    logger.warning(logLabel + " - dropped " + count + " msgs reason=" + reason);
    metrics.incrementDropped(reason, count);
  }

  private static String preview(PublishMessage msg) {
    if (msg.isSensitive()) {
      return "<sensitive>";
    }
    String payload = msg.payload();
    return payload.length() <= PAYLOAD_PREVIEW_CHARS ? payload : payload.substring(0, PAYLOAD_PREVIEW_CHARS);
  }
}
