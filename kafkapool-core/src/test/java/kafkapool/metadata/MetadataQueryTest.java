package kafkapool.metadata;

import kafkapool.spi.BrokerClientException;
import kafkapool.spi.StubBrokerClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetadataQueryTest {

  private final StubBrokerClient client = new StubBrokerClient();
  private final MetadataQuery query = new MetadataQuery("ktp");

  @Test
  void singlePartitionWatermarksGiveMessageCount() {
    client.metadata(cluster(topic("t1", 1))).watermarks("t1", 0, new Watermarks(0, 42));

    MetadataReport report = query.run(client, true, "t1");

    assertEquals(42L, report.messageCount("t1").getAsLong());
    assertEquals(1, report.metadata().brokers().size());
  }

  @Test
  void partitionsOfOneTopicAreSummed() {
    client.metadata(cluster(topic("t1", 3)))
        .watermarks("t1", 0, new Watermarks(0, 10))
        .watermarks("t1", 1, new Watermarks(5, 25))
        .watermarks("t1", 2, new Watermarks(100, 100));

    assertEquals(30L, query.run(client, true, "t1").messageCount("t1").getAsLong());
  }

  @Test
  void countsAreKeptPerTopic() {
    client.metadata(cluster(topic("a", 1), topic("b", 1)))
        .watermarks("a", 0, new Watermarks(0, 7))
        .watermarks("b", 0, new Watermarks(0, 3));

    MetadataReport report = query.run(client, true, null);

    assertNull(client.lastMetadataTopic());
    assertEquals(7L, report.messageCount("a").getAsLong());
    assertEquals(3L, report.messageCount("b").getAsLong());
  }

  @Test
  void failedWatermarkFetchCountsAsZero() {
    client.metadata(cluster(topic("t1", 2))).watermarks("t1", 0, new Watermarks(2, 12));

    assertEquals(10L, query.run(client, true, "t1").messageCount("t1").getAsLong());
  }

  @Test
  void withoutOffsetsNoCountsAreReported() {
    client.metadata(cluster(topic("t1", 1)));

    MetadataReport report = query.run(client, false, "t1");

    assertTrue(report.messageCounts().isEmpty());
    assertTrue(report.messageCount("t1").isEmpty());
    assertEquals(1, report.metadata().topics().size());
  }

  @Test
  void metadataFailurePropagates() {
    StubBrokerClient failing = new StubBrokerClient() {
      @Override
      public ClusterMetadata fetchMetadata(String topic, Duration timeout) {
        throw new BrokerClientException("timed out");
      }
    };

    assertThrows(BrokerClientException.class, () -> query.run(failing, true, null));
  }

  @Test
  void unknownWatermarksHaveZeroCount() {
    assertEquals(0L, Watermarks.UNKNOWN.messageCount());
  }

  private static ClusterMetadata cluster(TopicMetadata... topics) {
    return new ClusterMetadata(List.of(new BrokerInfo(1, "localhost", 9092)), List.of(topics));
  }

  private static TopicMetadata topic(String name, int partitions) {
    List<PartitionMetadata> list = new ArrayList<>();
    for (int i = 0; i < partitions; i++) {
      list.add(new PartitionMetadata(i, 1, List.of(1), List.of(1), null));
    }
    return new TopicMetadata(name, null, list);
  }
}
