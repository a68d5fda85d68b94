package dk.cloudcreate.toggles.eventsourced.aggregates;

/**
 * Base exception for business rule violations raised by an aggregate, either when deciding which events a command
 * results in or when applying an event to the aggregate's state
 */
public class AggregateException extends RuntimeException {
    public AggregateException() {
    }

    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateException(Throwable cause) {
        super(cause);
    }
}
