package kafkapool.metadata;

import java.util.List;

/**
 * Snapshot of the brokers and topics returned by {@link kafkapool.spi.BrokerClient#fetchMetadata}.
 */
public record ClusterMetadata(List<BrokerInfo> brokers, List<TopicMetadata> topics) {

  public static final ClusterMetadata EMPTY = new ClusterMetadata(List.of(), List.of());

  public ClusterMetadata {
    brokers = List.copyOf(brokers);
    topics = List.copyOf(topics);
  }
}
