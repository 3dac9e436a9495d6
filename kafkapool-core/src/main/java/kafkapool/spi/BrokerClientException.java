package kafkapool.spi;

/**
 * Unchecked failure raised by a {@link BrokerClient} or {@link BrokerClientFactory}.
 */
public class BrokerClientException extends RuntimeException {

  public BrokerClientException(String message) {
    super(message);
  }

  public BrokerClientException(String message, Throwable cause) {
    super(message, cause);
  }
}
