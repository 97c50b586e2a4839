package dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer;

import dk.cloudcreate.domainkit.eventsourced.aggregates.store.EventStoreException;

public class EventSerializationException extends EventStoreException {
    public EventSerializationException(String message, Exception cause) {
        super(message, cause);
    }
}
