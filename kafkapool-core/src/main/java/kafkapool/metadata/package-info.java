/**
 * Read-only cluster metadata reporting.
 *
 * @see kafkapool.metadata.MetadataQuery
 * @see kafkapool.metadata.MetadataReport
 */
package kafkapool.metadata;
