package dk.cloudcreate.toggles.eventstore.postgresql.persistence;

import dk.cloudcreate.toggles.eventstore.postgresql.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
