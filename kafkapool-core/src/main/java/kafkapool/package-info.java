/**
 * Root API of kafkapool: a fixed-size thread pool that publishes messages to Kafka
 * asynchronously from an in-memory queue.
 *
 * <h2>Core Design</h2>
 * <p>Callers enqueue {@link kafkapool.PublishMessage}s through a {@link kafkapool.KafkaPublisher}
 * and return immediately. A {@linkplain kafkapool.dispatch.WorkerPool pool} of workers drains the
 * shared {@linkplain kafkapool.queue.WorkQueue queue} in batches of at most ten messages, each
 * worker publishing through its own broker connection and retrying failed publishes until they
 * succeed. Shutdown is requested by enqueuing a single {@link kafkapool.MessageKind#SHUTDOWN}
 * message; each worker that sees it puts it back so the others see it too.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>kafkapool-core</b>: queue, workers, facade, configuration (no Kafka dependency)</li>
 *   <li><b>kafkapool-kafka</b>: broker client on top of {@code kafka-clients}</li>
 *   <li><b>kafkapool-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>kafkapool-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * PoolConfig config = EnvironmentConfigLoader.fromEnvironment("orders");
 * KafkaPublisher publisher = KafkaThreadpool.start(config, new KafkaBrokerClientFactory());
 *
 * publisher.addDataMsg("testing", "key-1", Map.of("source", "orders"), "{\"id\":1}");
 * publisher.getMetadata(true, "testing");
 *
 * publisher.shutdown();
 * publisher.awaitTermination(Duration.ofSeconds(10));
 * }</pre>
 *
 * @see kafkapool.KafkaThreadpool
 * @see kafkapool.KafkaPublisher
 * @see kafkapool.PublishMessage
 */
package kafkapool;
