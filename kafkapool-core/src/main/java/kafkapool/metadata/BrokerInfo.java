package kafkapool.metadata;

/**
 * A broker of the cluster.
 */
public record BrokerInfo(int id, String host, int port) {

  @Override
  public String toString() {
    return "broker.id=" + id + " address=" + host + ":" + port;
  }
}
