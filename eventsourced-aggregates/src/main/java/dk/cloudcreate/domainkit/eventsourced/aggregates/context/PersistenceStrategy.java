package dk.cloudcreate.domainkit.eventsourced.aggregates.context;

/**
 * How the aggregates of an aggregate type are persisted
 */
public enum PersistenceStrategy {
    /**
     * The aggregate's state is derived from its event history, which is stored in an
     * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.store.EventStoreRepository}.<br>
     * The aggregate type must implement {@link dk.cloudcreate.domainkit.eventsourced.aggregates.EventSourced}
     */
    EVENT_SOURCED,
    /**
     * The aggregate's current state is stored in a
     * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.repository.SnapshotRepository}
     */
    SNAPSHOT
}
