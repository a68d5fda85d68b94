package dk.cloudcreate.toggles.eventstore.postgresql.serializer.json;

import dk.cloudcreate.toggles.eventstore.postgresql.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String message) {
        super(message);
    }

    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
