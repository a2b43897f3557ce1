package ledger.model;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain event, the unit of the append-only log.
 *
 * <p>Events are created by aggregates without a position. The event store assigns the
 * global {@code eventNumber} and the per-stream {@code streamVersion} at append time and
 * returns positioned copies via {@link #withPosition(long, long)}; both are {@code 0} for
 * events that have not been appended yet.
 *
 * <p>Each event is assigned a monotonic ULID {@code eventId} by default. The payload is a flat
 * string map, encoded as a JSON object by stores that persist it.
 *
 * @see ledger.spi.EventStore
 */
public final class DomainEvent {
    /** Aggregate type used when the producer does not set one. */
    public static final String GLOBAL_AGGREGATE_TYPE = "__GLOBAL__";

    private final String eventId;
    private final String streamId;
    private final String aggregateType;
    private final String eventType;
    private final long eventNumber;
    private final long streamVersion;
    private final Map<String, String> payload;
    private final EventMetadata metadata;
    private final Instant occurredAt;

    private DomainEvent(Builder builder) {
        this.eventId = builder.eventId == null ? UlidCreator.getMonotonicUlid().toString() : builder.eventId;
        this.streamId = Objects.requireNonNull(builder.streamId, "streamId");
        if (this.streamId.isEmpty()) {
            throw new IllegalArgumentException("streamId cannot be empty");
        }
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
        if (this.eventType.isEmpty()) {
            throw new IllegalArgumentException("eventType cannot be empty");
        }
        this.aggregateType = builder.aggregateType == null ? GLOBAL_AGGREGATE_TYPE : builder.aggregateType;
        if (builder.eventNumber < 0 || builder.streamVersion < 0) {
            throw new IllegalArgumentException("eventNumber and streamVersion must be >= 0");
        }
        this.eventNumber = builder.eventNumber;
        this.streamVersion = builder.streamVersion;

        Map<String, String> payloadCopy = builder.payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        if (payloadCopy.containsKey(null)) {
            throw new IllegalArgumentException("payload cannot contain null keys");
        }
        if (payloadCopy.containsValue(null)) {
            throw new IllegalArgumentException("payload cannot contain null values");
        }
        this.payload = payloadCopy;
        this.metadata = builder.metadata == null ? EventMetadata.EMPTY : builder.metadata;
        this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
    }

    public static Builder builder(String eventType) {
        return new Builder(eventType);
    }

    public String eventId() {
        return eventId;
    }

    public String streamId() {
        return streamId;
    }

    public String aggregateType() {
        return aggregateType;
    }

    public String eventType() {
        return eventType;
    }

    /**
     * Global, strictly increasing position in the log; {@code 0} before append.
     */
    public long eventNumber() {
        return eventNumber;
    }

    /**
     * One-based position within the owning stream; {@code 0} before append.
     */
    public long streamVersion() {
        return streamVersion;
    }

    public Map<String, String> payload() {
        return payload;
    }

    public EventMetadata metadata() {
        return metadata;
    }

    public String userId() {
        return metadata.userId();
    }

    public Instant occurredAt() {
        return occurredAt;
    }

    public boolean isAppended() {
        return eventNumber > 0;
    }

    /**
     * Returns a copy of this event carrying the given log positions.
     */
    public DomainEvent withPosition(long eventNumber, long streamVersion) {
        return toBuilder().eventNumber(eventNumber).streamVersion(streamVersion).build();
    }

    public DomainEvent withMetadata(EventMetadata metadata) {
        return toBuilder().metadata(metadata).build();
    }

    public Builder toBuilder() {
        return new Builder(eventType)
                .eventId(eventId)
                .streamId(streamId)
                .aggregateType(aggregateType)
                .eventNumber(eventNumber)
                .streamVersion(streamVersion)
                .payload(payload)
                .metadata(metadata)
                .occurredAt(occurredAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DomainEvent other)) {
            return false;
        }
        return eventNumber == other.eventNumber
                && streamVersion == other.streamVersion
                && eventId.equals(other.eventId)
                && streamId.equals(other.streamId)
                && aggregateType.equals(other.aggregateType)
                && eventType.equals(other.eventType)
                && payload.equals(other.payload)
                && metadata.equals(other.metadata)
                && occurredAt.equals(other.occurredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventNumber, streamId, eventType);
    }

    @Override
    public String toString() {
        return "DomainEvent{eventId=" + eventId
                + ", eventType=" + eventType
                + ", streamId=" + streamId
                + ", eventNumber=" + eventNumber
                + ", streamVersion=" + streamVersion + '}';
    }

    /**
     * Builder for {@link DomainEvent}.
     */
    public static final class Builder {
        private final String eventType;
        private String eventId;
        private String streamId;
        private String aggregateType;
        private long eventNumber;
        private long streamVersion;
        private Map<String, String> payload;
        private EventMetadata metadata;
        private Instant occurredAt;

        private Builder(String eventType) {
            this.eventType = eventType;
        }

        /**
         * Sets a custom event identifier. Optional; defaults to a monotonic ULID.
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the identifier of the owning aggregate. Required.
         */
        public Builder streamId(String streamId) {
            this.streamId = streamId;
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder eventNumber(long eventNumber) {
            this.eventNumber = eventNumber;
            return this;
        }

        public Builder streamVersion(long streamVersion) {
            this.streamVersion = streamVersion;
            return this;
        }

        public Builder payload(Map<String, String> payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(EventMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        /**
         * Sets the event timestamp. Optional; defaults to {@link Instant#now()}.
         */
        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public DomainEvent build() {
            return new DomainEvent(this);
        }
    }
}
