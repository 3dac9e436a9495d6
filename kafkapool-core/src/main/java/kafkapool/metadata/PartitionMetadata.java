package kafkapool.metadata;

import java.util.List;

/**
 * Layout of one partition.
 *
 * @param id       partition id
 * @param leader   leader broker id, {@code -1} when there is none
 * @param replicas replica broker ids
 * @param isr      in-sync replica broker ids
 * @param error    error reported for the partition, or {@code null}
 */
public record PartitionMetadata(int id, int leader, List<Integer> replicas, List<Integer> isr, String error) {

  public PartitionMetadata {
    replicas = List.copyOf(replicas);
    isr = List.copyOf(isr);
  }
}
