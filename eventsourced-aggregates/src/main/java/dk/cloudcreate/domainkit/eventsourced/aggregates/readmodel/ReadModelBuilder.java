package dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel;

import dk.cloudcreate.domainkit.eventsourced.aggregates.AggregateEvent;

/**
 * Builds and maintains a read model (projection) from the events of one aggregate type.<br>
 * Builders are registered per aggregate type using
 * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext#registerBuilder(dk.cloudcreate.domainkit.eventsourced.aggregates.AggregateType, ReadModelBuilderFactory)}
 * and receive every event saved for that aggregate type, after it has been persisted.
 * <p>
 * A builder may additionally implement {@link dk.cloudcreate.domainkit.eventsourced.aggregates.repository.ObservableRepository}
 * to announce the changes it makes to its read model.
 *
 * @see PatternMatchingReadModelBuilder
 */
public interface ReadModelBuilder extends AutoCloseable {
    /**
     * Handle a persisted event
     *
     * @param event the event
     */
    void handle(AggregateEvent<?> event);

    /**
     * Called when the owner of the builder is closed
     */
    @Override
    default void close() {
    }
}
