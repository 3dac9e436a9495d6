/**
 * Service provider interfaces the pool depends on.
 *
 * <ul>
 *   <li>{@link kafkapool.spi.BrokerClientFactory} / {@link kafkapool.spi.BrokerClient} &mdash;
 *       broker connection used to publish and to read metadata</li>
 *   <li>{@link kafkapool.spi.MetricsExporter} &mdash; counters and gauges</li>
 * </ul>
 */
package kafkapool.spi;
