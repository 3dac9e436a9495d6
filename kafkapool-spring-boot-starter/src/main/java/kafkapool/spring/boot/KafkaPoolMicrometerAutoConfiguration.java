package kafkapool.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import kafkapool.micrometer.MicrometerMetricsExporter;
import kafkapool.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code kafkapool.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link KafkaPoolAutoConfiguration} so the exporter is picked up by the
 * publisher.
 */
@AutoConfiguration(before = KafkaPoolAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "kafkapool.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(KafkaPoolProperties.class)
public class KafkaPoolMicrometerAutoConfiguration {

  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, KafkaPoolProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
