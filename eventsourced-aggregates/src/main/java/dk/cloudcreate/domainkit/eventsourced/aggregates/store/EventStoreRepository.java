package dk.cloudcreate.domainkit.eventsourced.aggregates.store;

import java.util.*;

/**
 * Gateway to the durable storage of {@link StoredEvent}'s.<br>
 * Aggregate id's are keyed by their {@link String#valueOf(Object)} representation.
 *
 * @see dk.cloudcreate.domainkit.eventsourced.aggregates.store.inmemory.InMemoryEventStore
 */
public interface EventStoreRepository extends AutoCloseable {
    /**
     * Create a new blank {@link StoredEvent} record
     */
    default StoredEvent newStoredEvent() {
        return new StoredEvent();
    }

    /**
     * Get all {@link StoredEvent}'s related to the given aggregate, ordered by {@link StoredEvent#version()} ascending
     *
     * @param aggregateId the aggregate id
     * @return the stored events (empty if none exist)
     */
    List<StoredEvent> getAllAggregateEvents(Object aggregateId);

    /**
     * Get the {@link StoredEvent} with the highest version related to the given aggregate
     *
     * @param aggregateId the aggregate id
     * @return the last stored event or {@link Optional#empty()} if none exist
     */
    Optional<StoredEvent> getLastAggregateEvent(Object aggregateId);

    /**
     * Append a single {@link StoredEvent}
     *
     * @param storedEvent the record to append
     * @throws EventStoreException if a record with the same aggregate id and version already exists
     */
    void save(StoredEvent storedEvent);

    /**
     * Perform <code>work</code> so that either all or none of the writes it performs against this store, and against the
     * {@link AggregateManifestRepository} paired with it, take effect.<br>
     * If called while another <code>executeAtomically</code> is in progress on the same thread the outer call's atomicity applies.
     *
     * @param work the work to perform
     */
    void executeAtomically(Runnable work);

    /**
     * Release the resources held on behalf of the caller (e.g. connections).<br>
     * Records already stored are unaffected and the repository can still be used afterwards by other callers
     */
    @Override
    void close();
}
