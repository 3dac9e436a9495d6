package kafkapool.metadata;

import java.util.List;

/**
 * Layout of one topic.
 *
 * @param name       topic name
 * @param error      error reported for the topic, or {@code null}
 * @param partitions partitions in id order
 */
public record TopicMetadata(String name, String error, List<PartitionMetadata> partitions) {

  public TopicMetadata {
    partitions = List.copyOf(partitions);
  }
}
