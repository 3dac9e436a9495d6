package kafkapool.metadata;

/**
 * Low and high offset bounds of a partition.
 */
public record Watermarks(long low, long high) {

  /** Returned when the offsets could not be fetched. */
  public static final Watermarks UNKNOWN = new Watermarks(-1, -1);

  /**
   * @return estimated number of messages retained in the partition
   */
  public long messageCount() {
    return high - low;
  }
}
