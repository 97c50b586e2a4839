package dk.cloudcreate.domainkit.eventsourced.aggregates.store;

import dk.cloudcreate.domainkit.eventsourced.aggregates.ConcurrencyException;

/**
 * Tracks the version of the last committed event per aggregate id and acts as the final gate against lost updates
 */
public interface AggregateManifestRepository {
    /**
     * Atomically replace the recorded version of the aggregate with <code>newVersion</code>, provided the recorded version
     * is <code>expectedVersion</code> (an aggregate without an entry has version 0)
     *
     * @param aggregateId     the aggregate id
     * @param expectedVersion the version the caller expects to be recorded
     * @param newVersion      the version after the caller's events have been appended
     * @throws ConcurrencyException if the recorded version differs from <code>expectedVersion</code>
     */
    void updateManifest(Object aggregateId, long expectedVersion, long newVersion);

    /**
     * @param aggregateId the aggregate id
     * @return the recorded version or 0 if the aggregate has no entry
     */
    long getManifestVersion(Object aggregateId);
}
