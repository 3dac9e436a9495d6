package kafkapool.spi;

import kafkapool.config.TlsSettings;

import java.util.List;

/**
 * Opens {@link BrokerClient} connections. Called once per worker at startup and once per
 * metadata query.
 */
@FunctionalInterface
public interface BrokerClientFactory {

  /**
   * @param brokers {@code host:port} bootstrap list, never empty
   * @param tls     PEM paths for mutual TLS; {@link TlsSettings#isEmpty() empty} means plaintext
   * @return a connected client
   * @throws BrokerClientException if the client cannot be created
   */
  BrokerClient connect(List<String> brokers, TlsSettings tls);
}
