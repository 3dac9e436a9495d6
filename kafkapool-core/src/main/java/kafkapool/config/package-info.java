/**
 * Pool configuration: the immutable {@link kafkapool.config.PoolConfig} and its loader for the
 * {@code KAFKA_*} environment variables.
 */
package kafkapool.config;
