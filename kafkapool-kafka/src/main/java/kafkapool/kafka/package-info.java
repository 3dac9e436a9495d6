/**
 * Broker client implementation on top of Apache {@code kafka-clients}.
 *
 * @see kafkapool.kafka.KafkaBrokerClientFactory
 */
package kafkapool.kafka;
