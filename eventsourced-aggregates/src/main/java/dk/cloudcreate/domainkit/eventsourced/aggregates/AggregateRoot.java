package dk.cloudcreate.domainkit.eventsourced.aggregates;

import dk.cloudcreate.domainkit.eventsourced.aggregates.repository.AggregateRepository;

import java.util.List;

/**
 * Common interface for all aggregates, independent of how they're persisted.<br>
 * An aggregate tracks its current {@link #version()} and the events produced since it was loaded (or last saved).
 * The version of the N'th uncommitted event is always the version the aggregate had at load time + N.
 *
 * @param <ID> the aggregate id type
 * @see EventSourced
 * @see EventSourcedAggregateRoot
 */
public interface AggregateRoot<ID> {
    /**
     * The id of the aggregate
     */
    ID aggregateId();

    /**
     * The version of the last event applied to the aggregate or 0 if no events have been applied
     */
    long version();

    /**
     * The events that have been applied to this aggregate instance, in the order they were applied, but which haven't been
     * persisted by an {@link AggregateRepository} yet
     */
    List<AggregateEvent<ID>> uncommittedEvents();

    /**
     * Resets the {@link #uncommittedEvents()} - effectively marking them as having been persisted and committed
     */
    void markChangesAsCommitted();
}
