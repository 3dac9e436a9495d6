package kafkapool.spi;

import kafkapool.metadata.ClusterMetadata;
import kafkapool.metadata.Watermarks;

import java.time.Duration;
import java.util.Map;

/**
 * Connection to the broker cluster, owned by exactly one worker or metadata query.
 *
 * <p>Implementations do not need to be thread-safe: the pool never shares a client between
 * threads.
 */
public interface BrokerClient extends AutoCloseable {

  /** Status returned by {@link #publish} when the broker acknowledged the record. */
  int SUCCESS = 0;

  /**
   * Publishes one record and waits for the delivery report.
   *
   * @param topic       destination topic
   * @param key         partition key
   * @param headers     record headers, possibly empty
   * @param payload     record value
   * @param timestampMs record timestamp in epoch milliseconds
   * @return {@link #SUCCESS} or a non-zero broker error code
   */
  int publish(String topic, String key, Map<String, String> headers, byte[] payload, long timestampMs);

  /**
   * Fetches cluster metadata for one topic or for all topics.
   *
   * @param topic   topic to describe, or {@code null} for every topic
   * @param timeout upper bound for the request
   * @return brokers and topic layout
   * @throws BrokerClientException if the metadata cannot be fetched in time
   */
  ClusterMetadata fetchMetadata(String topic, Duration timeout);

  /**
   * Fetches the low and high watermark offsets of a partition.
   *
   * @param topic     topic name
   * @param partition partition id
   * @param timeout   upper bound for the request
   * @return the watermark pair
   * @throws BrokerClientException if the offsets cannot be fetched in time
   */
  Watermarks fetchWatermarks(String topic, int partition, Duration timeout);

  /**
   * Releases the connection. Must not throw checked exceptions.
   */
  @Override
  void close();
}
