package kafkapool;

/**
 * The kind of a {@link PublishMessage}, which decides how a worker handles it.
 */
public enum MessageKind {
    /** Regular payload, published to its topic. */
    DATA,
    /** Published like {@link #DATA}, but the payload is never written to logs. */
    SENSITIVE,
    /** Poison pill that tells workers to stop. Topic, key and payload are ignored. */
    SHUTDOWN,
    /** Reserved: log broker details. Accepted by the queue but not handled yet. */
    LOG_BROKER_DETAILS,
    /** Reserved: log broker topic details. Accepted by the queue but not handled yet. */
    LOG_BROKER_TOPIC_DETAILS;

    /**
     * Returns {@code true} for kinds that a worker publishes to the broker.
     *
     * @return whether messages of this kind carry a publishable payload
     */
    public boolean isPublishable() {
        return this == DATA || this == SENSITIVE;
    }
}
