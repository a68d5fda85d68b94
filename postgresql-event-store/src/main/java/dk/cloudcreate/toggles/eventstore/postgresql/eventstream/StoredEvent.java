package dk.cloudcreate.toggles.eventstore.postgresql.eventstream;

import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A single event row exactly as it is kept in the event store.<br>
 * All columns are kept in their serialized form; turning a row into a typed event is the job of the
 * code that reads the row.
 */
public final class StoredEvent {
    /**
     * Globally unique event id (UUID string)
     */
    public final String     eventId;
    public final String     aggregateId;
    /**
     * Position of the event in the aggregate's event stream
     */
    public final Generation generation;
    /**
     * RFC3339 timestamp
     */
    public final String     createdAt;
    /**
     * Event type discriminator, e.g. <code>Created</code>
     */
    public final String     eventType;
    /**
     * The JSON serialized event
     */
    public final String     data;

    public StoredEvent(String eventId,
                       String aggregateId,
                       Generation generation,
                       String createdAt,
                       String eventType,
                       String data) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.generation = requireNonNull(generation, "No generation provided");
        this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.data = requireNonNull(data, "No data provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredEvent)) return false;
        StoredEvent that = (StoredEvent) o;
        return eventId.equals(that.eventId) &&
                aggregateId.equals(that.aggregateId) &&
                generation.equals(that.generation) &&
                createdAt.equals(that.createdAt) &&
                eventType.equals(that.eventType) &&
                data.equals(that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, generation, createdAt, eventType, data);
    }

    @Override
    public String toString() {
        return "StoredEvent{" +
                "eventId='" + eventId + '\'' +
                ", aggregateId='" + aggregateId + '\'' +
                ", generation=" + generation +
                ", createdAt='" + createdAt + '\'' +
                ", eventType='" + eventType + '\'' +
                ", data='" + data + '\'' +
                '}';
    }
}
