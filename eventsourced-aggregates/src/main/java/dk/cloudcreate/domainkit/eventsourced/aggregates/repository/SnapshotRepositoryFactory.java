package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext;

@FunctionalInterface
public interface SnapshotRepositoryFactory {
    SnapshotRepository<?, ?> create(DomainContext context);
}
