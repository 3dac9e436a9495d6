package kafkapool.spi;

import kafkapool.metadata.ClusterMetadata;
import kafkapool.metadata.Watermarks;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory BrokerClient for unit tests. One instance is handed out to every connect call of
 * {@link #factory()}, so records published by all workers end up in {@link #published}.
 */
public class StubBrokerClient implements BrokerClient {
  public final Queue<Record> published = new ConcurrentLinkedQueue<>();
  public final AtomicInteger publishCalls = new AtomicInteger();
  public final AtomicInteger connectCount = new AtomicInteger();
  public final AtomicInteger closeCount = new AtomicInteger();
  public final Map<String, Watermarks> watermarks = new ConcurrentHashMap<>();

  private final AtomicInteger failuresLeft = new AtomicInteger();
  private volatile int failureStatus = 7;
  private volatile RuntimeException publishException;
  private volatile ClusterMetadata metadata = ClusterMetadata.EMPTY;
  private volatile String lastMetadataTopic;

  public record Record(String topic, String key, Map<String, String> headers, String payload) {}

  /** Makes the next {@code count} publish calls return {@code status}. */
  public StubBrokerClient failNext(int count, int status) {
    failuresLeft.set(count);
    failureStatus = status;
    return this;
  }

  /** Makes every publish call throw {@code e} until cleared with {@code null}. */
  public StubBrokerClient throwOnPublish(RuntimeException e) {
    publishException = e;
    return this;
  }

  public StubBrokerClient metadata(ClusterMetadata metadata) {
    this.metadata = metadata;
    return this;
  }

  public StubBrokerClient watermarks(String topic, int partition, Watermarks value) {
    watermarks.put(topic + "/" + partition, value);
    return this;
  }

  public String lastMetadataTopic() {
    return lastMetadataTopic;
  }

  public BrokerClientFactory factory() {
    return (brokers, tls) -> {
      connectCount.incrementAndGet();
      return this;
    };
  }

  @Override
  public int publish(String topic, String key, Map<String, String> headers, byte[] payload, long timestampMs) {
    publishCalls.incrementAndGet();
    RuntimeException e = publishException;
    if (e != null) {
      throw e;
    }
    if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      return failureStatus;
    }
    published.add(new Record(topic, key, headers, new String(payload, StandardCharsets.UTF_8)));
    return SUCCESS;
  }

  @Override
  public ClusterMetadata fetchMetadata(String topic, Duration timeout) {
    lastMetadataTopic = topic;
    return metadata;
  }

  @Override
  public Watermarks fetchWatermarks(String topic, int partition, Duration timeout) {
    Watermarks value = watermarks.get(topic + "/" + partition);
    if (value == null) {
      throw new BrokerClientException("no watermarks for " + topic + "/" + partition);
    }
    return value;
  }

  @Override
  public void close() {
    closeCount.incrementAndGet();
  }

  public List<String> publishedPayloads() {
    return published.stream().map(Record::payload).toList();
  }
}
