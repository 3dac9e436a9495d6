package kafkapool.kafka;

import kafkapool.KafkaPublisher;
import kafkapool.KafkaThreadpool;
import kafkapool.config.PoolConfig;
import kafkapool.config.TlsSettings;
import kafkapool.metadata.ClusterMetadata;
import kafkapool.metadata.MetadataReport;
import kafkapool.metadata.TopicMetadata;
import kafkapool.metadata.Watermarks;
import kafkapool.spi.BrokerClient;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class KafkaBrokerClientIntegrationTest {

  @Container
  static final KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.5.3"));

  private static final TlsSettings PLAINTEXT = new TlsSettings("", "", "");

  @BeforeAll
  static void createTopics() throws Exception {
    try (AdminClient admin = AdminClient.create(Map.of(
        AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers()))) {
      admin.createTopics(List.of(
          new NewTopic("testing", 2, (short) 1),
          new NewTopic("direct", 1, (short) 1))).all().get();
    }
  }

  @Test
  void publishAndReadWatermarks() {
    try (BrokerClient client = new KafkaBrokerClientFactory().connect(List.of(kafka.getBootstrapServers()), PLAINTEXT)) {
      for (int i = 0; i < 3; i++) {
        assertEquals(BrokerClient.SUCCESS,
            client.publish("direct", "k", Map.of("h", "v"), ("m" + i).getBytes(), System.currentTimeMillis()));
      }

      Watermarks watermarks = client.fetchWatermarks("direct", 0, Duration.ofSeconds(5));
      assertEquals(3L, watermarks.messageCount());
    }
  }

  @Test
  void metadataListsBrokerAndTopicLayout() {
    try (BrokerClient client = new KafkaBrokerClientFactory().connect(List.of(kafka.getBootstrapServers()), PLAINTEXT)) {
      ClusterMetadata metadata = client.fetchMetadata("testing", Duration.ofSeconds(30));

      assertEquals(1, metadata.brokers().size());
      TopicMetadata topic = metadata.topics().get(0);
      assertEquals("testing", topic.name());
      assertNull(topic.error());
      assertEquals(2, topic.partitions().size());
    }
  }

  @Test
  void unknownTopicIsReportedAsTopicError() {
    try (BrokerClient client = new KafkaBrokerClientFactory().connect(List.of(kafka.getBootstrapServers()), PLAINTEXT)) {
      ClusterMetadata metadata = client.fetchMetadata("does-not-exist", Duration.ofSeconds(30));

      assertEquals("UNKNOWN_TOPIC_OR_PARTITION", metadata.topics().get(0).error());
    }
  }

  @Test
  void poolPublishesEverythingBeforeShutdown() throws Exception {
    PoolConfig config = PoolConfig.builder("ktp-it")
        .broker(kafka.getBootstrapServers())
        .topic("testing")
        .numThreads(3)
        .idleSleep(Duration.ofMillis(50))
        .build();

    try (KafkaPublisher publisher = KafkaThreadpool.start(config, new KafkaBrokerClientFactory())) {
      for (int i = 0; i < 100; i++) {
        publisher.addDataMsg("testing", "key-" + i, Map.of(), "test message " + i);
      }
      publisher.shutdown();
      assertTrue(publisher.awaitTermination(Duration.ofSeconds(60)));

      MetadataReport report = publisher.getMetadata(true, "testing");
      assertEquals(100L, report.messageCount("testing").getAsLong());
    }
  }
}
