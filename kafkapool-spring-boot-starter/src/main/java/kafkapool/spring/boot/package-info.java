/**
 * Spring Boot auto-configuration for the publish pool.
 *
 * <p>Add the starter, set {@code kafkapool.brokers}, and inject {@link kafkapool.KafkaPublisher}.
 *
 * @see kafkapool.spring.boot.KafkaPoolAutoConfiguration
 * @see kafkapool.spring.boot.KafkaPoolProperties
 */
package kafkapool.spring.boot;
