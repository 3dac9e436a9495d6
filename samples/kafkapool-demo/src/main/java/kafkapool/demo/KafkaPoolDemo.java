package kafkapool.demo;

import kafkapool.KafkaPublisher;
import kafkapool.KafkaThreadpool;
import kafkapool.kafka.KafkaBrokerClientFactory;
import kafkapool.metadata.MetadataReport;

import java.time.Duration;
import java.util.Map;

/**
 * Publishes a burst of messages through the pool and prints the resulting topic offsets.
 *
 * <p>Reads {@code KAFKA_ENABLED}, {@code KAFKA_BROKERS} and the other {@code KAFKA_*}
 * variables from the environment. Expects a topic named {@code testing} to exist.
 * <p>
 * Run with: {@code KAFKA_BROKERS=localhost:9092 mvn -pl samples/kafkapool-demo exec:java}
 */
public final class KafkaPoolDemo {

    private static final String TOPIC = "testing";
    private static final int MESSAGES = 100;

    public static void main(String[] args) throws Exception {
        try (KafkaPublisher publisher =
                     KafkaThreadpool.startFromEnvironment("demo", new KafkaBrokerClientFactory())) {

            System.out.println("=== KafkaPool Demo ===\n");
            System.out.println("Config: " + publisher.config());

            for (int i = 0; i < MESSAGES; i++) {
                publisher.addDataMsg(TOPIC, "key-" + i, Map.of("seq", Integer.toString(i)),
                        "{\"seq\": " + i + "}");
            }
            System.out.println("Queued " + MESSAGES + " messages, pending=" + publisher.queue().size());

            System.out.println(publisher.shutdown());
            if (!publisher.awaitTermination(Duration.ofSeconds(30))) {
                System.out.println("Workers still running after 30s, closing");
            }

            MetadataReport report = publisher.getMetadata(true, TOPIC);
            System.out.println("\nBrokers: " + report.metadata().brokers());
            System.out.println("Message counts: " + report.messageCounts());
        }
    }
}
