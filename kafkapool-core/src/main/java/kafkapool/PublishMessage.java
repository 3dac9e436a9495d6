package kafkapool;

import com.github.f4b6a3.ulid.UlidCreator;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of work placed on the {@linkplain kafkapool.queue.WorkQueue work queue}.
 *
 * <p>Each message is assigned a ULID-based {@code messageId} by default, which is what log
 * lines refer to. For {@link MessageKind#SENSITIVE} messages {@link #toString()} leaves the
 * payload out.
 *
 * <p>Use the {@linkplain Builder builder} or the {@link #data}, {@link #sensitive} and
 * {@link #shutdown()} factory methods to create instances.
 */
public final class PublishMessage {
    private final String messageId;
    private final MessageKind kind;
    private final String topic;
    private final String key;
    private final Map<String, String> headers;
    private final String payload;

    private PublishMessage(Builder builder) {
        this.messageId = builder.messageId == null ? newMessageId() : builder.messageId;
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.topic = builder.topic == null ? "" : builder.topic;
        this.key = builder.key == null ? "" : builder.key;
        this.payload = builder.payload == null ? "" : builder.payload;

        Map<String, String> headerCopy = builder.headers == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        if (headerCopy.containsKey(null)) {
            throw new IllegalArgumentException("headers cannot contain null keys");
        }
        this.headers = headerCopy;
    }

    public static Builder builder(MessageKind kind) {
        return new Builder(kind);
    }

    public static PublishMessage data(String topic, String key, Map<String, String> headers, String payload) {
        return builder(MessageKind.DATA).topic(topic).key(key).headers(headers).payload(payload).build();
    }

    public static PublishMessage sensitive(String topic, String key, Map<String, String> headers, String payload) {
        return builder(MessageKind.SENSITIVE).topic(topic).key(key).headers(headers).payload(payload).build();
    }

    public static PublishMessage shutdown() {
        return builder(MessageKind.SHUTDOWN).build();
    }

    private static String newMessageId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /**
     * Returns a copy of this message with the same id and content.
     *
     * @return an equal, distinct instance
     */
    public PublishMessage copy() {
        return builder(kind)
                .messageId(messageId)
                .topic(topic)
                .key(key)
                .headers(headers)
                .payload(payload)
                .build();
    }

    public String messageId() {
        return messageId;
    }

    public MessageKind kind() {
        return kind;
    }

    public String topic() {
        return topic;
    }

    public String key() {
        return key;
    }

    public Map<String, String> headers() {
        return headers;
    }

    public String payload() {
        return payload;
    }

    public byte[] payloadBytes() {
        return payload.getBytes(StandardCharsets.UTF_8);
    }

    public boolean isSensitive() {
        return kind == MessageKind.SENSITIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublishMessage that)) return false;
        return messageId.equals(that.messageId)
                && kind == that.kind
                && topic.equals(that.topic)
                && key.equals(that.key)
                && headers.equals(that.headers)
                && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, kind, topic, key, headers, payload);
    }

    @Override
    public String toString() {
        if (isSensitive()) {
            return "SENSITIVE PublishMessage{id=" + messageId
                    + ", kind=" + kind
                    + ", topic=" + topic
                    + ", key=" + key
                    + ", headers=" + headers + "}";
        }
        return "PublishMessage{id=" + messageId
                + ", kind=" + kind
                + ", topic=" + topic
                + ", key=" + key
                + ", headers=" + headers
                + ", payload=" + payload + "}";
    }

    /**
     * Builder for {@link PublishMessage}.
     */
    public static final class Builder {
        private final MessageKind kind;
        private String messageId;
        private String topic;
        private String key;
        private Map<String, String> headers;
        private String payload;

        private Builder(MessageKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder topic(String topic) {
            this.topic = topic;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers == null ? null : new LinkedHashMap<>(headers);
            return this;
        }

        public Builder header(String name, String value) {
            if (this.headers == null) {
                this.headers = new LinkedHashMap<>();
            }
            this.headers.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public Builder payload(String payload) {
            this.payload = payload;
            return this;
        }

        public PublishMessage build() {
            return new PublishMessage(this);
        }
    }
}
