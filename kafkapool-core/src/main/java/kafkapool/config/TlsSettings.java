package kafkapool.config;

import java.util.Objects;

/**
 * Paths to the PEM files used for mutual TLS. Empty strings mean "not set".
 *
 * @param caPath   certificate authority used to verify brokers
 * @param certPath client certificate chain
 * @param keyPath  client private key
 */
public record TlsSettings(String caPath, String certPath, String keyPath) {

  public TlsSettings {
    caPath = Objects.requireNonNullElse(caPath, "");
    certPath = Objects.requireNonNullElse(certPath, "");
    keyPath = Objects.requireNonNullElse(keyPath, "");
  }

  /**
   * @return {@code true} when no path is set and the transport stays plaintext
   */
  public boolean isEmpty() {
    return caPath.isEmpty() && certPath.isEmpty() && keyPath.isEmpty();
  }
}
