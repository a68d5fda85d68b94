package dk.cloudcreate.toggles.eventstore.postgresql.serializer.json;

import dk.cloudcreate.toggles.eventstore.postgresql.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
