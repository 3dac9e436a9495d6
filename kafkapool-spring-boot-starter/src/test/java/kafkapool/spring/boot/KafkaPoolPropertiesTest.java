package kafkapool.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KafkaPoolPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(KafkaPoolProperties.class);
            assertTrue(props.isEnabled());
            assertEquals("ktp", props.getLabel());
            assertTrue(props.getBrokers().isEmpty());
            assertEquals(5, props.getNumThreads());
            assertEquals(Duration.ofSeconds(1), props.getRetrySleep());
            assertEquals(Duration.ofMillis(500), props.getIdleSleep());
            assertEquals(10, props.getBatchSize());
            assertEquals(5000, props.getDrainTimeoutMs());
            assertEquals("", props.getTls().getCa());
            assertEquals(KafkaPoolProperties.Retry.Strategy.FIXED, props.getRetry().getStrategy());
            assertEquals(0, props.getRetry().getMaxAttempts());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("kafkapool", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "kafkapool.enabled=false",
                "kafkapool.label=orders",
                "kafkapool.brokers=b1:9092,b2:9092",
                "kafkapool.topics=testing",
                "kafkapool.num-threads=8",
                "kafkapool.retry-sleep=2s",
                "kafkapool.idle-sleep=100ms",
                "kafkapool.batch-size=20",
                "kafkapool.drain-timeout-ms=10000",
                "kafkapool.tls.key=/certs/client.key",
                "kafkapool.tls.cert=/certs/client.crt",
                "kafkapool.tls.ca=/certs/ca.pem",
                "kafkapool.retry.strategy=EXPONENTIAL",
                "kafkapool.retry.base-delay-ms=500",
                "kafkapool.retry.max-delay-ms=30000",
                "kafkapool.retry.max-attempts=12",
                "kafkapool.metrics.enabled=false",
                "kafkapool.metrics.name-prefix=orders.pool"
        ).run(ctx -> {
            var props = ctx.getBean(KafkaPoolProperties.class);
            assertFalse(props.isEnabled());
            assertEquals("orders", props.getLabel());
            assertEquals(List.of("b1:9092", "b2:9092"), props.getBrokers());
            assertEquals(List.of("testing"), props.getTopics());
            assertEquals(8, props.getNumThreads());
            assertEquals(Duration.ofSeconds(2), props.getRetrySleep());
            assertEquals(Duration.ofMillis(100), props.getIdleSleep());
            assertEquals(20, props.getBatchSize());
            assertEquals(10000, props.getDrainTimeoutMs());
            assertEquals("/certs/client.key", props.getTls().getKey());
            assertEquals("/certs/client.crt", props.getTls().getCert());
            assertEquals("/certs/ca.pem", props.getTls().getCa());
            assertEquals(KafkaPoolProperties.Retry.Strategy.EXPONENTIAL, props.getRetry().getStrategy());
            assertEquals(500, props.getRetry().getBaseDelayMs());
            assertEquals(30000, props.getRetry().getMaxDelayMs());
            assertEquals(12, props.getRetry().getMaxAttempts());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("orders.pool", props.getMetrics().getNamePrefix());
        });
    }

    @Configuration
    @EnableConfigurationProperties(KafkaPoolProperties.class)
    static class PropsConfig {
    }
}
