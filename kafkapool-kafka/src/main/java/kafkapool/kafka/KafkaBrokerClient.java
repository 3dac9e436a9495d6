package kafkapool.kafka;

import kafkapool.config.TlsSettings;
import kafkapool.metadata.BrokerInfo;
import kafkapool.metadata.ClusterMetadata;
import kafkapool.metadata.PartitionMetadata;
import kafkapool.metadata.TopicMetadata;
import kafkapool.metadata.Watermarks;
import kafkapool.spi.BrokerClient;
import kafkapool.spi.BrokerClientException;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.TopicPartitionInfo;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.protocol.Errors;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerClient} backed by a {@link KafkaProducer}. The admin client and the offset
 * consumer used for metadata queries are created on first use, so publish-only workers never
 * open them.
 *
 * <p>Not thread-safe; each worker owns its own instance.
 */
public final class KafkaBrokerClient implements BrokerClient {
  private static final Logger logger = Logger.getLogger(KafkaBrokerClient.class.getName());

  static final int UNKNOWN_ERROR = -1;
  private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

  private final List<String> brokers;
  private final TlsSettings tls;
  private final Map<String, Object> overrides;
  private final KafkaProducer<String, byte[]> producer;
  private AdminClient admin;
  private KafkaConsumer<byte[], byte[]> offsetConsumer;

  /**
   * @throws BrokerClientException if the producer cannot be created
   */
  public KafkaBrokerClient(List<String> brokers, TlsSettings tls, Map<String, Object> overrides) {
    this.brokers = List.copyOf(brokers);
    this.tls = Objects.requireNonNull(tls, "tls");
    this.overrides = Map.copyOf(overrides);
    try {
      this.producer = new KafkaProducer<>(KafkaClientProperties.producer(this.brokers, tls, this.overrides));
    } catch (KafkaException e) {
      throw new BrokerClientException("failed to create producer for brokers=" + brokers, e);
    }
  }

  @Override
  public int publish(String topic, String key, Map<String, String> headers, byte[] payload, long timestampMs) {
    ProducerRecord<String, byte[]> record =
        new ProducerRecord<>(topic, null, timestampMs, key, payload, toHeaders(headers));
    try {
      producer.send(record).get();
      return SUCCESS;
    } catch (ExecutionException e) {
      logger.log(Level.FINE, "delivery failed topic=" + topic, e.getCause());
      return errorCode(e.getCause());
    } catch (KafkaException e) {
      logger.log(Level.FINE, "send failed topic=" + topic, e);
      return errorCode(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return UNKNOWN_ERROR;
    }
  }

  @Override
  public ClusterMetadata fetchMetadata(String topic, Duration timeout) {
    AdminClient client = admin();
    List<BrokerInfo> brokerInfos = new ArrayList<>();
    for (Node node : await(client.describeCluster().nodes(), timeout, "describe cluster")) {
      brokerInfos.add(new BrokerInfo(node.id(), node.host(), node.port()));
    }

    Set<String> names = topic != null
        ? Set.of(topic)
        : new TreeSet<>(await(client.listTopics().names(), timeout, "list topics"));
    Map<String, KafkaFuture<TopicDescription>> described = client.describeTopics(names).topicNameValues();

    List<TopicMetadata> topics = new ArrayList<>();
    for (String name : new TreeSet<>(names)) {
      topics.add(describe(name, described.get(name), timeout));
    }
    return new ClusterMetadata(brokerInfos, topics);
  }

  private static TopicMetadata describe(String name, KafkaFuture<TopicDescription> future, Duration timeout) {
    TopicDescription description;
    try {
      description = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      return new TopicMetadata(name, Errors.forException(e.getCause()).name(), List.of());
    } catch (TimeoutException e) {
      return new TopicMetadata(name, Errors.REQUEST_TIMED_OUT.name(), List.of());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerClientException("interrupted while describing topic " + name, e);
    }
    List<PartitionMetadata> partitions = new ArrayList<>();
    for (TopicPartitionInfo info : description.partitions()) {
      partitions.add(new PartitionMetadata(
          info.partition(),
          info.leader() == null ? -1 : info.leader().id(),
          nodeIds(info.replicas()),
          nodeIds(info.isr()),
          null));
    }
    return new TopicMetadata(name, null, partitions);
  }

  @Override
  public Watermarks fetchWatermarks(String topic, int partition, Duration timeout) {
    TopicPartition tp = new TopicPartition(topic, partition);
    try {
      KafkaConsumer<byte[], byte[]> consumer = offsetConsumer();
      Long low = consumer.beginningOffsets(List.of(tp), timeout).get(tp);
      Long high = consumer.endOffsets(List.of(tp), timeout).get(tp);
      if (low == null || high == null) {
        return Watermarks.UNKNOWN;
      }
      return new Watermarks(low, high);
    } catch (KafkaException e) {
      throw new BrokerClientException("failed to fetch watermarks for " + tp, e);
    }
  }

  @Override
  public void close() {
    closeQuietly("producer", () -> producer.close(CLOSE_TIMEOUT));
    if (admin != null) {
      closeQuietly("admin client", () -> admin.close(CLOSE_TIMEOUT));
    }
    if (offsetConsumer != null) {
      closeQuietly("offset consumer", () -> offsetConsumer.close(CLOSE_TIMEOUT));
    }
  }

  private AdminClient admin() {
    if (admin == null) {
      try {
        admin = AdminClient.create(KafkaClientProperties.admin(brokers, tls, overrides));
      } catch (KafkaException e) {
        throw new BrokerClientException("failed to create admin client for brokers=" + brokers, e);
      }
    }
    return admin;
  }

  private KafkaConsumer<byte[], byte[]> offsetConsumer() {
    if (offsetConsumer == null) {
      offsetConsumer = new KafkaConsumer<>(KafkaClientProperties.offsetConsumer(brokers, tls, overrides));
    }
    return offsetConsumer;
  }

  private static <T> T await(KafkaFuture<T> future, Duration timeout, String what) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new BrokerClientException("failed to " + what, e.getCause());
    } catch (TimeoutException e) {
      throw new BrokerClientException("timed out after " + timeout.toMillis() + "ms trying to " + what, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BrokerClientException("interrupted while trying to " + what, e);
    }
  }

  private static void closeQuietly(String what, Runnable close) {
    try {
      close.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "failed to close kafka " + what, e);
    }
  }

  static RecordHeaders toHeaders(Map<String, String> headers) {
    RecordHeaders recordHeaders = new RecordHeaders();
    if (headers != null) {
      headers.forEach((name, value) -> recordHeaders.add(new RecordHeader(name,
          value == null ? null : value.getBytes(StandardCharsets.UTF_8))));
    }
    return recordHeaders;
  }

  /**
   * Maps a delivery failure to the broker's numeric error code, {@code -1} when it has none.
   */
  static int errorCode(Throwable failure) {
    if (failure == null) {
      return UNKNOWN_ERROR;
    }
    int code = Errors.forException(failure).code();
    return code == Errors.NONE.code() ? UNKNOWN_ERROR : code;
  }

  private static List<Integer> nodeIds(Collection<Node> nodes) {
    List<Integer> ids = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      ids.add(node.id());
    }
    return ids;
  }
}
