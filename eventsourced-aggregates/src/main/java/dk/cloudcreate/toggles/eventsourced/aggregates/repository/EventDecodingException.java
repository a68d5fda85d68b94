package dk.cloudcreate.toggles.eventsourced.aggregates.repository;

import dk.cloudcreate.toggles.eventstore.postgresql.EventStoreException;
import dk.cloudcreate.toggles.eventstore.postgresql.eventstream.StoredEvent;

/**
 * Thrown when a stored event row can't be turned back into a typed event
 */
public class EventDecodingException extends EventStoreException {
    /**
     * The offending row. <code>null</code> when the failure concerns the stream as a whole
     */
    public final StoredEvent storedEvent;

    public EventDecodingException(String message) {
        this(message, (StoredEvent) null);
    }

    public EventDecodingException(String message, StoredEvent storedEvent) {
        super(message);
        this.storedEvent = storedEvent;
    }

    public EventDecodingException(String message, StoredEvent storedEvent, Throwable cause) {
        super(message, cause);
        this.storedEvent = storedEvent;
    }
}
