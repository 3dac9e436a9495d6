package kafkapool.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the publish pool.
 *
 * @see KafkaPoolAutoConfiguration
 */
@ConfigurationProperties(prefix = "kafkapool")
public class KafkaPoolProperties {

    /**
     * Whether the pool starts workers. When false every publisher operation is a no-op.
     */
    private boolean enabled = true;

    /**
     * Tracking label prefixed to log lines and worker thread names.
     */
    private String label = "ktp";

    /**
     * Bootstrap brokers as {@code host:port}.
     */
    private List<String> brokers = new ArrayList<>();

    /**
     * Topics the application publishes to. Informational, logged at startup.
     */
    private List<String> topics = new ArrayList<>();

    private int numThreads = 5;
    private Duration retrySleep = Duration.ofSeconds(1);
    private Duration idleSleep = Duration.ofMillis(500);
    private int batchSize = 10;
    private long drainTimeoutMs = 5000;

    private final Tls tls = new Tls();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public List<String> getBrokers() {
        return brokers;
    }

    public void setBrokers(List<String> brokers) {
        this.brokers = brokers;
    }

    public List<String> getTopics() {
        return topics;
    }

    public void setTopics(List<String> topics) {
        this.topics = topics;
    }

    public int getNumThreads() {
        return numThreads;
    }

    public void setNumThreads(int numThreads) {
        this.numThreads = numThreads;
    }

    public Duration getRetrySleep() {
        return retrySleep;
    }

    public void setRetrySleep(Duration retrySleep) {
        this.retrySleep = retrySleep;
    }

    public Duration getIdleSleep() {
        return idleSleep;
    }

    public void setIdleSleep(Duration idleSleep) {
        this.idleSleep = idleSleep;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public Tls getTls() {
        return tls;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * PEM file paths for mutual TLS. All empty means plaintext.
     */
    public static class Tls {
        private String key = "";
        private String cert = "";
        private String ca = "";

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getCert() {
            return cert;
        }

        public void setCert(String cert) {
            this.cert = cert;
        }

        public String getCa() {
            return ca;
        }

        public void setCa(String ca) {
            this.ca = ca;
        }
    }

    public static class Retry {
        /**
         * FIXED waits {@code retry-sleep} between attempts; EXPONENTIAL backs off from
         * {@code base-delay-ms} up to {@code max-delay-ms}.
         */
        private Strategy strategy = Strategy.FIXED;
        private long baseDelayMs = 200;
        private long maxDelayMs = 60000;

        /**
         * Attempts per message before it is dropped; 0 retries forever.
         */
        private int maxAttempts = 0;

        public Strategy getStrategy() {
            return strategy;
        }

        public void setStrategy(Strategy strategy) {
            this.strategy = strategy;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public enum Strategy {
            FIXED,
            EXPONENTIAL
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "kafkapool";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
