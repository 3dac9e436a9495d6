package kafkapool.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable settings shared read-only by the publisher facade and every worker.
 *
 * <p>Instances are created once, either through {@link #builder(String)} or
 * {@link EnvironmentConfigLoader}, and never change afterwards. A disabled configuration
 * starts no workers and turns every facade operation into a no-op.
 */
public final class PoolConfig {
  /** Sleep durations at or below this value would turn the worker loops into a busy spin. */
  public static final Duration MIN_SLEEP = Duration.ofMillis(1);

  private final String label;
  private final boolean enabled;
  private final List<String> brokerList;
  private final Set<String> publishTopics;
  private final int numThreads;
  private final Duration retrySleep;
  private final Duration idleSleep;
  private final TlsSettings tls;

  private PoolConfig(Builder builder) {
    this.label = Objects.requireNonNull(builder.label, "label");
    if (label.isEmpty()) {
      throw new IllegalArgumentException("label must not be empty");
    }
    this.enabled = builder.enabled;
    this.brokerList = Collections.unmodifiableList(new ArrayList<>(builder.brokerList));
    this.publishTopics = Collections.unmodifiableSet(new LinkedHashSet<>(builder.publishTopics));
    this.retrySleep = Objects.requireNonNull(builder.retrySleep, "retrySleep");
    this.idleSleep = Objects.requireNonNull(builder.idleSleep, "idleSleep");
    this.tls = new TlsSettings(builder.tlsCa, builder.tlsCert, builder.tlsKey);

    if (builder.numThreads < 0) {
      throw new IllegalArgumentException("numThreads must be >= 0, got: " + builder.numThreads);
    }
    this.numThreads = builder.numThreads;
    if (enabled) {
      requireAboveMinimum("retrySleep", retrySleep);
      requireAboveMinimum("idleSleep", idleSleep);
    }
  }

  private static void requireAboveMinimum(String name, Duration value) {
    if (value.compareTo(MIN_SLEEP) <= 0) {
      throw new IllegalArgumentException(name + " must be > " + MIN_SLEEP.toMillis() + "ms, got: "
          + value.toMillis() + "ms");
    }
  }

  public static Builder builder(String label) {
    return new Builder(label);
  }

  /**
   * Returns a configuration with the pool switched off.
   *
   * @param label tracking label used in log lines
   * @return a disabled configuration
   */
  public static PoolConfig disabled(String label) {
    return builder(label).enabled(false).numThreads(0).build();
  }

  public String label() {
    return label;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public List<String> brokerList() {
    return brokerList;
  }

  public Set<String> publishTopics() {
    return publishTopics;
  }

  public int numThreads() {
    return numThreads;
  }

  public Duration retrySleep() {
    return retrySleep;
  }

  public Duration idleSleep() {
    return idleSleep;
  }

  public TlsSettings tls() {
    return tls;
  }

  public boolean isTlsEnabled() {
    return !tls.isEmpty();
  }

  /**
   * @return {@code true} when there is at least one broker and the first entry is not blank
   */
  public boolean hasBrokers() {
    return !brokerList.isEmpty() && !brokerList.get(0).isBlank();
  }

  @Override
  public String toString() {
    return "PoolConfig{label=" + label
        + ", enabled=" + enabled
        + ", tls key=" + tls.keyPath() + " cert=" + tls.certPath() + " ca=" + tls.caPath()
        + ", retrySleep=" + retrySleep.toMillis() + "ms"
        + ", idleSleep=" + idleSleep.toMillis() + "ms"
        + ", threads=" + numThreads
        + ", brokers=" + brokerList
        + ", topics=" + publishTopics + "}";
  }

  /** Builder for {@link PoolConfig}. */
  public static final class Builder {
    private final String label;
    private boolean enabled = true;
    private final List<String> brokerList = new ArrayList<>();
    private final Set<String> publishTopics = new LinkedHashSet<>();
    private int numThreads = 5;
    private Duration retrySleep = Duration.ofSeconds(1);
    private Duration idleSleep = Duration.ofMillis(500);
    private String tlsKey = "";
    private String tlsCert = "";
    private String tlsCa = "";

    private Builder(String label) {
      this.label = label;
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder brokers(List<String> brokers) {
      this.brokerList.clear();
      this.brokerList.addAll(Objects.requireNonNull(brokers, "brokers"));
      return this;
    }

    public Builder broker(String broker) {
      this.brokerList.add(Objects.requireNonNull(broker, "broker"));
      return this;
    }

    public Builder topics(Set<String> topics) {
      this.publishTopics.clear();
      this.publishTopics.addAll(Objects.requireNonNull(topics, "topics"));
      return this;
    }

    public Builder topic(String topic) {
      this.publishTopics.add(Objects.requireNonNull(topic, "topic"));
      return this;
    }

    public Builder numThreads(int numThreads) {
      this.numThreads = numThreads;
      return this;
    }

    public Builder retrySleep(Duration retrySleep) {
      this.retrySleep = retrySleep;
      return this;
    }

    public Builder idleSleep(Duration idleSleep) {
      this.idleSleep = idleSleep;
      return this;
    }

    public Builder tlsKey(String tlsKey) {
      this.tlsKey = tlsKey;
      return this;
    }

    public Builder tlsCert(String tlsCert) {
      this.tlsCert = tlsCert;
      return this;
    }

    public Builder tlsCa(String tlsCa) {
      this.tlsCa = tlsCa;
      return this;
    }

    /**
     * @return a new immutable configuration
     * @throws IllegalArgumentException if the label is empty, {@code numThreads < 0}, or an
     *     enabled configuration has a sleep duration of {@link #MIN_SLEEP} or less
     */
    public PoolConfig build() {
      return new PoolConfig(this);
    }
  }
}
