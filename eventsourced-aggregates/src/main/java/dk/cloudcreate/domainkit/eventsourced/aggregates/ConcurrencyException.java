package dk.cloudcreate.domainkit.eventsourced.aggregates;

import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Thrown when an aggregate is saved based on a stale version, i.e. another writer has committed events for the same
 * aggregate after this copy was loaded.<br>
 * The caller is expected to reload the aggregate and retry the command (or give up)
 */
public class ConcurrencyException extends AggregateException {
    public final Object   aggregateId;
    /**
     * The aggregate implementation type - <code>null</code> when the conflict was detected by a component that doesn't know the
     * aggregate implementation type (e.g. an {@code AggregateManifestRepository})
     */
    public final Class<?> aggregateImplementationType;
    /**
     * The version the writer expected the last persisted event to have
     */
    public final long     expectedVersion;
    /**
     * The version of the last persisted event (0 if no events have been persisted)
     */
    public final long     actualVersion;

    public ConcurrencyException(Object aggregateId, Class<?> aggregateImplementationType, long expectedVersion, long actualVersion) {
        super(msg("Expected version '{}' for '{}' with id '{}' but found version '{}'",
                  expectedVersion,
                  aggregateImplementationType.getName(),
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateImplementationType = aggregateImplementationType;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public ConcurrencyException(Object aggregateId, long expectedVersion, long actualVersion) {
        super(msg("Expected version '{}' for aggregate with id '{}' but found version '{}'",
                  expectedVersion,
                  aggregateId,
                  actualVersion));
        this.aggregateId = aggregateId;
        this.aggregateImplementationType = null;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
