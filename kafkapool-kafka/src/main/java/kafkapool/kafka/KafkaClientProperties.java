package kafkapool.kafka;

import kafkapool.config.TlsSettings;
import kafkapool.spi.BrokerClientException;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Builds the {@code kafka-clients} configuration for producers, admin clients and the
 * offset consumer.
 *
 * <p>Without TLS material the connection is plaintext. When any TLS path is set the
 * security protocol is {@code SSL} and the PEM files are loaded inline: the CA into the
 * trust store, the client certificate chain and private key into the key store. Hostname
 * verification keeps the client default.
 */
public final class KafkaClientProperties {

  /** Upper bound for one delivery report, including retries inside the producer. */
  public static final int DELIVERY_TIMEOUT_MS = 5000;
  static final int ADMIN_TIMEOUT_MS = 30000;

  private KafkaClientProperties() {}

  public static Properties producer(List<String> brokers, TlsSettings tls, Map<String, Object> overrides) {
    Properties props = common(brokers, tls);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, DELIVERY_TIMEOUT_MS);
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, DELIVERY_TIMEOUT_MS);
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, DELIVERY_TIMEOUT_MS);
    props.putAll(overrides);
    return props;
  }

  public static Properties admin(List<String> brokers, TlsSettings tls, Map<String, Object> overrides) {
    Properties props = common(brokers, tls);
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, ADMIN_TIMEOUT_MS);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, ADMIN_TIMEOUT_MS);
    props.putAll(overrides);
    return props;
  }

  /** Consumer used only for watermark lookups: no group, no commits. */
  public static Properties offsetConsumer(List<String> brokers, TlsSettings tls, Map<String, Object> overrides) {
    Properties props = common(brokers, tls);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.putAll(overrides);
    return props;
  }

  private static Properties common(List<String> brokers, TlsSettings tls) {
    if (brokers == null || brokers.isEmpty()) {
      throw new IllegalArgumentException("brokers must not be empty");
    }
    Properties props = new Properties();
    props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, String.join(",", brokers));
    applyTls(props, tls);
    return props;
  }

  static void applyTls(Properties props, TlsSettings tls) {
    if (tls == null || tls.isEmpty()) {
      return;
    }
    props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SSL");
    if (!tls.caPath().isEmpty()) {
      props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, "PEM");
      props.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, readPem(tls.caPath()));
    }
    if (!tls.certPath().isEmpty() || !tls.keyPath().isEmpty()) {
      if (tls.certPath().isEmpty() || tls.keyPath().isEmpty()) {
        throw new BrokerClientException("client TLS needs both a certificate and a key, got cert="
            + tls.certPath() + " key=" + tls.keyPath());
      }
      props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, "PEM");
      props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, readPem(tls.certPath()));
      props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, readPem(tls.keyPath()));
    }
  }

  private static String readPem(String path) {
    try {
      return Files.readString(Path.of(path));
    } catch (IOException e) {
      throw new BrokerClientException("failed to read PEM file " + path, e);
    }
  }
}
