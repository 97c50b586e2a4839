package dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer;

import dk.cloudcreate.domainkit.eventsourced.aggregates.store.EventStoreException;

public class EventDeserializationException extends EventStoreException {
    public EventDeserializationException(String message) {
        super(message);
    }

    public EventDeserializationException(String message, Exception cause) {
        super(message, cause);
    }
}
