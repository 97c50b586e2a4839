package dk.cloudcreate.domainkit.eventsourced.aggregates.test_data;

import dk.cloudcreate.domainkit.eventsourced.aggregates.repository.SnapshotRepository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySnapshotRepository<ID, AGGREGATE_TYPE> implements SnapshotRepository<ID, AGGREGATE_TYPE> {
    private final Map<ID, AGGREGATE_TYPE> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<AGGREGATE_TYPE> getById(ID aggregateId) {
        return Optional.ofNullable(snapshots.get(aggregateId));
    }

    @Override
    public List<AGGREGATE_TYPE> getAll() {
        return new ArrayList<>(snapshots.values());
    }

    @Override
    public void save(ID aggregateId, AGGREGATE_TYPE aggregate) {
        snapshots.put(aggregateId, aggregate);
    }

    @Override
    public void deleteId(ID aggregateId) {
        snapshots.remove(aggregateId);
    }
}
