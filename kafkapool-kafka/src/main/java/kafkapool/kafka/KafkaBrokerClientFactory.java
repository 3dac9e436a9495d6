package kafkapool.kafka;

import kafkapool.config.TlsSettings;
import kafkapool.spi.BrokerClient;
import kafkapool.spi.BrokerClientFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Opens a {@link KafkaBrokerClient} per worker.
 *
 * <p>Extra {@code kafka-clients} settings passed to the constructor are applied on top of the
 * defaults of {@link KafkaClientProperties}, for producer, admin client and offset consumer alike.
 */
public final class KafkaBrokerClientFactory implements BrokerClientFactory {
  private final Map<String, Object> overrides;

  public KafkaBrokerClientFactory() {
    this(Map.of());
  }

  public KafkaBrokerClientFactory(Map<String, Object> overrides) {
    this.overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides"));
  }

  @Override
  public BrokerClient connect(List<String> brokers, TlsSettings tls) {
    return new KafkaBrokerClient(brokers, tls, overrides);
  }

  public Map<String, Object> overrides() {
    return overrides;
  }
}
