/**
 * Micrometer bridge for pool metrics.
 *
 * @see kafkapool.micrometer.MicrometerMetricsExporter
 */
package kafkapool.micrometer;
