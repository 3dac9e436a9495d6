package kafkapool.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Builds a validated {@link PoolConfig} from environment variables.
 *
 * <table>
 *   <caption>Supported variables</caption>
 *   <tr><th>Variable</th><th>Meaning</th><th>Default</th></tr>
 *   <tr><td>{@code KAFKA_ENABLED}</td><td>{@code true} or {@code 1} enables the pool</td><td>{@code true}</td></tr>
 *   <tr><td>{@code KAFKA_LOG_LABEL}</td><td>label in every log line</td><td>caller's label</td></tr>
 *   <tr><td>{@code KAFKA_BROKERS}</td><td>comma-delimited {@code host:port} list</td><td>empty</td></tr>
 *   <tr><td>{@code KAFKA_TOPICS}</td><td>comma-delimited topic list</td><td>empty</td></tr>
 *   <tr><td>{@code KAFKA_PUBLISH_RETRY_INTERVAL_SEC}</td><td>seconds between publish retries</td><td>{@code 1}</td></tr>
 *   <tr><td>{@code KAFKA_PUBLISH_IDLE_INTERVAL_SEC}</td><td>seconds to sleep when the queue is empty</td><td>{@code 0.5}</td></tr>
 *   <tr><td>{@code KAFKA_NUM_THREADS}</td><td>number of workers</td><td>{@code 5}</td></tr>
 *   <tr><td>{@code KAFKA_TLS_CLIENT_KEY}</td><td>PEM private key path</td><td>empty</td></tr>
 *   <tr><td>{@code KAFKA_TLS_CLIENT_CERT}</td><td>PEM certificate path</td><td>empty</td></tr>
 *   <tr><td>{@code KAFKA_TLS_CLIENT_CA}</td><td>PEM CA path</td><td>empty</td></tr>
 * </table>
 */
public final class EnvironmentConfigLoader {
  private static final Logger logger = Logger.getLogger(EnvironmentConfigLoader.class.getName());

  public static final String DEFAULT_LABEL = "ktp";

  public static final String KAFKA_ENABLED = "KAFKA_ENABLED";
  public static final String KAFKA_LOG_LABEL = "KAFKA_LOG_LABEL";
  public static final String KAFKA_BROKERS = "KAFKA_BROKERS";
  public static final String KAFKA_TOPICS = "KAFKA_TOPICS";
  public static final String KAFKA_PUBLISH_RETRY_INTERVAL_SEC = "KAFKA_PUBLISH_RETRY_INTERVAL_SEC";
  public static final String KAFKA_PUBLISH_IDLE_INTERVAL_SEC = "KAFKA_PUBLISH_IDLE_INTERVAL_SEC";
  public static final String KAFKA_NUM_THREADS = "KAFKA_NUM_THREADS";
  public static final String KAFKA_TLS_CLIENT_KEY = "KAFKA_TLS_CLIENT_KEY";
  public static final String KAFKA_TLS_CLIENT_CERT = "KAFKA_TLS_CLIENT_CERT";
  public static final String KAFKA_TLS_CLIENT_CA = "KAFKA_TLS_CLIENT_CA";

  private final Function<String, String> env;

  public EnvironmentConfigLoader() {
    this(System::getenv);
  }

  public EnvironmentConfigLoader(Map<String, String> env) {
    this(Objects.requireNonNull(env, "env")::get);
  }

  public EnvironmentConfigLoader(Function<String, String> env) {
    this.env = Objects.requireNonNull(env, "env");
  }

  /**
   * Loads the configuration from the process environment.
   *
   * @param label label to use when {@code KAFKA_LOG_LABEL} is not set
   * @return a validated configuration
   */
  public static PoolConfig fromEnvironment(String label) {
    return new EnvironmentConfigLoader().load(label);
  }

  /**
   * @param label label to use when {@code KAFKA_LOG_LABEL} is not set; {@code null} means
   *     {@value #DEFAULT_LABEL}
   * @return a validated configuration
   * @throws IllegalArgumentException naming the offending variable when a value is invalid
   */
  public PoolConfig load(String label) {
    String fallbackLabel = label == null || label.isEmpty() ? DEFAULT_LABEL : label;
    String useLabel = get(KAFKA_LOG_LABEL, fallbackLabel);

    String enabledValue = get(KAFKA_ENABLED, "true").toLowerCase(Locale.ROOT);
    if (!enabledValue.equals("true") && !enabledValue.equals("1")) {
      logger.info("kafka disabled " + KAFKA_ENABLED + "=" + enabledValue);
      return PoolConfig.disabled(useLabel);
    }

    Duration retrySleep = parseSeconds(KAFKA_PUBLISH_RETRY_INTERVAL_SEC, get(KAFKA_PUBLISH_RETRY_INTERVAL_SEC, "1"));
    Duration idleSleep = parseSeconds(KAFKA_PUBLISH_IDLE_INTERVAL_SEC, get(KAFKA_PUBLISH_IDLE_INTERVAL_SEC, "0.5"));
    int numThreads = parseThreads(get(KAFKA_NUM_THREADS, "5"));

    PoolConfig.Builder builder = PoolConfig.builder(useLabel)
        .enabled(true)
        .numThreads(numThreads)
        .retrySleep(retrySleep)
        .idleSleep(idleSleep)
        .tlsKey(get(KAFKA_TLS_CLIENT_KEY, ""))
        .tlsCert(get(KAFKA_TLS_CLIENT_CERT, ""))
        .tlsCa(get(KAFKA_TLS_CLIENT_CA, ""));
    splitList(get(KAFKA_BROKERS, "")).forEach(builder::broker);
    splitList(get(KAFKA_TOPICS, "")).forEach(builder::topic);

    PoolConfig config = builder.build();
    logger.info("built config " + config);
    return config;
  }

  private String get(String name, String defaultValue) {
    String value = env.apply(name);
    return value == null ? defaultValue : value;
  }

  private static Duration parseSeconds(String name, String value) {
    double seconds;
    try {
      seconds = Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid sleep interval " + name + "=" + value
          + " please set to a positive float between [0.002, inf]", e);
    }
    long millis = (long) (seconds * 1000.0);
    if (Double.isNaN(seconds) || millis <= PoolConfig.MIN_SLEEP.toMillis()) {
      throw new IllegalArgumentException("please use a positive float for " + name + "=" + value
          + " please set to a number between [0.002, inf]");
    }
    return Duration.ofMillis(millis);
  }

  private static int parseThreads(String value) {
    int threads;
    try {
      threads = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid number of threads " + KAFKA_NUM_THREADS + "=" + value, e);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("please use a valid number of threads "
          + KAFKA_NUM_THREADS + "=" + value + " (must be >= 1)");
    }
    return threads;
  }

  private static List<String> splitList(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
