package kafkapool.metadata;

import kafkapool.spi.BrokerClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-shot, read-only report of the cluster layout.
 *
 * <p>Logs every broker, topic and partition. When offsets are requested, the watermarks of
 * each partition are fetched and {@code high - low} is summed into a per-topic message count.
 * A partition whose watermarks cannot be fetched counts as {@link Watermarks#UNKNOWN}.
 */
public final class MetadataQuery {
  private static final Logger logger = Logger.getLogger(MetadataQuery.class.getName());

  public static final Duration METADATA_TIMEOUT = Duration.ofSeconds(30);
  public static final Duration WATERMARK_TIMEOUT = Duration.ofSeconds(1);

  private final String label;

  public MetadataQuery(String label) {
    this.label = Objects.requireNonNull(label, "label");
  }

  /**
   * @param client       connected client, not closed by this method
   * @param fetchOffsets whether to count messages through watermark offsets
   * @param topic        topic to describe, or {@code null} for all topics
   * @return the logged report
   * @throws kafkapool.spi.BrokerClientException if the metadata fetch fails
   */
  public MetadataReport run(BrokerClient client, boolean fetchOffsets, String topic) {
    Objects.requireNonNull(client, "client");
    logger.info(label + " - getting metadata topic=" + (topic == null ? "<all>" : topic));
    ClusterMetadata metadata = client.fetchMetadata(topic, METADATA_TIMEOUT);

    StringBuilder brokerListing = new StringBuilder();
    for (BrokerInfo broker : metadata.brokers()) {
      brokerListing.append(broker).append(' ');
    }
    logger.info(label + " - cluster info brokers=" + metadata.brokers().size()
        + " num_topics=" + metadata.topics().size() + " " + brokerListing);

    Map<String, Long> counts = new LinkedHashMap<>();
    for (TopicMetadata found : metadata.topics()) {
      logger.info(label + " - topic=" + found.name() + " err=" + found.error());
      long messageCount = 0;
      for (PartitionMetadata partition : found.partitions()) {
        logger.info(label + " - topic=" + found.name()
            + " partition=" + partition.id()
            + " leader=" + partition.leader()
            + " replicas=" + partition.replicas()
            + " ISR=" + partition.isr()
            + " err=" + partition.error());
        if (fetchOffsets) {
          Watermarks watermarks = watermarks(client, found.name(), partition.id());
          logger.info(label + " - topic=" + found.name()
              + " watermark low=" + watermarks.low()
              + " high=" + watermarks.high()
              + " (difference=" + watermarks.messageCount() + ")");
          messageCount += watermarks.messageCount();
        }
      }
      if (fetchOffsets) {
        logger.info(label + " - topic=" + found.name() + " message offset=" + messageCount);
        counts.put(found.name(), messageCount);
      }
    }
    return new MetadataReport(metadata, counts);
  }

  private Watermarks watermarks(BrokerClient client, String topic, int partition) {
    try {
      return client.fetchWatermarks(topic, partition, WATERMARK_TIMEOUT);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, label + " - failed to fetch watermarks topic=" + topic
          + " partition=" + partition, e);
      return Watermarks.UNKNOWN;
    }
  }
}
