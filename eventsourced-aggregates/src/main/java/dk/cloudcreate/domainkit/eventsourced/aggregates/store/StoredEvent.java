package dk.cloudcreate.domainkit.eventsourced.aggregates.store;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * The durable form of a single aggregate event as handled by an {@link EventStoreRepository}.<br>
 * Records are append only: once persisted they're never updated or deleted.
 * <p>
 * The <code>(aggregateId, version)</code> pair is unique within an {@link EventStoreRepository}
 */
public class StoredEvent {
    private String         aggregateId;
    private UUID           eventId;
    private long           version;
    /**
     * Fully qualified class name of the event
     */
    private String         eventType;
    /**
     * The serialized form of the event, as produced by an {@link EventSerializer}
     */
    private String         event;
    /**
     * When the record was added to the store (assigned by the {@link EventStoreRepository})
     */
    private OffsetDateTime timestamp;

    public String aggregateId() {
        return aggregateId;
    }

    public StoredEvent aggregateId(String aggregateId) {
        this.aggregateId = aggregateId;
        return this;
    }

    public UUID eventId() {
        return eventId;
    }

    public StoredEvent eventId(UUID eventId) {
        this.eventId = eventId;
        return this;
    }

    public long version() {
        return version;
    }

    public StoredEvent version(long version) {
        this.version = version;
        return this;
    }

    public String eventType() {
        return eventType;
    }

    public StoredEvent eventType(String eventType) {
        this.eventType = eventType;
        return this;
    }

    public String event() {
        return event;
    }

    public StoredEvent event(String event) {
        this.event = event;
        return this;
    }

    public OffsetDateTime timestamp() {
        return timestamp;
    }

    public StoredEvent timestamp(OffsetDateTime timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    /**
     * Create a detached copy of this record. Stores that keep records in memory hand out copies, so a caller can't
     * rewrite a persisted record
     */
    public StoredEvent copy() {
        return new StoredEvent().aggregateId(aggregateId)
                                .eventId(eventId)
                                .version(version)
                                .eventType(eventType)
                                .event(event)
                                .timestamp(timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredEvent)) return false;
        var that = (StoredEvent) o;
        return version == that.version && Objects.equals(aggregateId, that.aggregateId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, version);
    }

    @Override
    public String toString() {
        return "StoredEvent{" +
                "aggregateId='" + aggregateId + '\'' +
                ", eventId=" + eventId +
                ", version=" + version +
                ", eventType='" + eventType + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
