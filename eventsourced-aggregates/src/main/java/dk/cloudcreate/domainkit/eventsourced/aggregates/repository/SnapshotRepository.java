package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import java.util.*;

/**
 * Stores the current state of aggregates that are persisted using
 * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.context.PersistenceStrategy#SNAPSHOT}
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public interface SnapshotRepository<ID, AGGREGATE_TYPE> {
    Optional<AGGREGATE_TYPE> getById(ID aggregateId);

    List<AGGREGATE_TYPE> getAll();

    void save(ID aggregateId, AGGREGATE_TYPE aggregate);

    void deleteId(ID aggregateId);
}
