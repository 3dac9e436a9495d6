package kafkapool.spring.boot;

import kafkapool.KafkaPublisher;
import kafkapool.KafkaThreadpool;
import kafkapool.config.PoolConfig;
import kafkapool.dispatch.ExponentialBackoffRetryPolicy;
import kafkapool.dispatch.FixedIntervalRetryPolicy;
import kafkapool.dispatch.RetryPolicy;
import kafkapool.kafka.KafkaBrokerClientFactory;
import kafkapool.spi.BrokerClientFactory;
import kafkapool.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.LinkedHashSet;

/**
 * Auto-configuration for the publish pool.
 *
 * <p>Builds a {@link PoolConfig} from {@link KafkaPoolProperties} and starts a
 * {@link KafkaPublisher} on top of {@code kafka-clients}. Any of the three beans can be
 * replaced by declaring one of the same type.
 *
 * @see KafkaPoolProperties
 * @see KafkaPoolMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(KafkaThreadpool.class)
@EnableConfigurationProperties(KafkaPoolProperties.class)
public class KafkaPoolAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PoolConfig kafkaPoolConfig(KafkaPoolProperties props) {
    if (!props.isEnabled()) {
      return PoolConfig.disabled(props.getLabel());
    }
    return PoolConfig.builder(props.getLabel())
        .brokers(props.getBrokers())
        .topics(new LinkedHashSet<>(props.getTopics()))
        .numThreads(props.getNumThreads())
        .retrySleep(props.getRetrySleep())
        .idleSleep(props.getIdleSleep())
        .tlsKey(props.getTls().getKey())
        .tlsCert(props.getTls().getCert())
        .tlsCa(props.getTls().getCa())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(BrokerClientFactory.class)
  public KafkaBrokerClientFactory brokerClientFactory() {
    return new KafkaBrokerClientFactory();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public KafkaPublisher kafkaPublisher(KafkaPoolProperties props,
      PoolConfig config,
      BrokerClientFactory clientFactory,
      ObjectProvider<MetricsExporter> metricsProvider) {
    KafkaThreadpool.Builder builder = KafkaThreadpool.builder()
        .config(config)
        .clientFactory(clientFactory)
        .retryPolicy(retryPolicy(props, config))
        .maxPublishAttempts(props.getRetry().getMaxAttempts())
        .batchSize(props.getBatchSize())
        .drainTimeoutMs(props.getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.start();
  }

  private static RetryPolicy retryPolicy(KafkaPoolProperties props, PoolConfig config) {
    KafkaPoolProperties.Retry retry = props.getRetry();
    return switch (retry.getStrategy()) {
      case FIXED -> new FixedIntervalRetryPolicy(config.retrySleep().toMillis());
      case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs());
    };
  }
}
