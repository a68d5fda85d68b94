package dk.cloudcreate.toggles.eventstore.postgresql;

/**
 * Base exception for all failures raised by the event store and the code that reads and writes event rows
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventStoreException(Throwable cause) {
        super(cause);
    }
}
