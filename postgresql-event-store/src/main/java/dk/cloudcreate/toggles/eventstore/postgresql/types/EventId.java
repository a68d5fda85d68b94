package dk.cloudcreate.toggles.eventstore.postgresql.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * Globally unique identifier of a single event. Always kept in canonical UUID form.
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(Uuids.canonical(value));
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }

    public static EventId of(UUID value) {
        return new EventId(value.toString());
    }

    /**
     * @param value the UUID value
     * @return the corresponding {@link EventId}
     * @throws IllegalArgumentException if the value isn't a valid UUID
     */
    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public UUID toUUID() {
        return UUID.fromString(value());
    }
}
