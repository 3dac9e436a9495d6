package kafkapool.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Result of a {@link MetadataQuery}: the fetched metadata plus, when offsets were requested,
 * the estimated message count of each topic.
 */
public final class MetadataReport {

  /** Report returned when the pool is disabled. */
  public static final MetadataReport EMPTY = new MetadataReport(ClusterMetadata.EMPTY, Map.of());

  private final ClusterMetadata metadata;
  private final Map<String, Long> messageCounts;

  public MetadataReport(ClusterMetadata metadata, Map<String, Long> messageCounts) {
    this.metadata = metadata;
    this.messageCounts = Collections.unmodifiableMap(new LinkedHashMap<>(messageCounts));
  }

  public ClusterMetadata metadata() {
    return metadata;
  }

  /**
   * @return message counts keyed by topic, empty when offsets were not fetched
   */
  public Map<String, Long> messageCounts() {
    return messageCounts;
  }

  public OptionalLong messageCount(String topic) {
    Long count = messageCounts.get(topic);
    return count == null ? OptionalLong.empty() : OptionalLong.of(count);
  }

  @Override
  public String toString() {
    return "MetadataReport{brokers=" + metadata.brokers().size()
        + ", topics=" + metadata.topics().size()
        + ", messageCounts=" + messageCounts + "}";
  }
}
