package dk.cloudcreate.domainkit.eventsourced.aggregates.store;

/**
 * Converts aggregate events to and from the string form stored in {@link StoredEvent#event()}.<br>
 * The string must carry enough type information for {@link #deserializeFromString(String)} to recreate an event
 * of the original concrete type.
 */
public interface EventSerializer {
    /**
     * @param event the event to serialize
     * @return the serialized event
     * @throws dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer.EventSerializationException if the event couldn't be serialized
     */
    String serializeToString(Object event);

    /**
     * @param serializedEvent an event serialized using {@link #serializeToString(Object)}
     * @return the deserialized event
     * @throws dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer.EventDeserializationException if the event couldn't be deserialized
     */
    Object deserializeFromString(String serializedEvent);
}
