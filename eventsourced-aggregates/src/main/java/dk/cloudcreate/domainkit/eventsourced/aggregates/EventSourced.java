package dk.cloudcreate.domainkit.eventsourced.aggregates;

import java.util.List;

/**
 * Capability implemented by aggregates whose state is derived purely from their own event history.<br>
 * Only aggregate types that implement this interface can be registered with
 * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.context.PersistenceStrategy#EVENT_SOURCED}
 *
 * @param <ID> the aggregate id type
 */
public interface EventSourced<ID> {
    /**
     * Effectively performs a leftFold over the previously persisted events related to this aggregate instance.<br>
     * Must only change the aggregate's own state and must not add anything to {@link AggregateRoot#uncommittedEvents()}
     *
     * @param history the previously persisted events, ordered by version
     */
    void loadFromEvents(List<? extends AggregateEvent<ID>> history);
}
