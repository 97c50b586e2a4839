package dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel;

import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.NotificationEventBus;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext;

/**
 * Creates a new {@link ReadModelBuilder} instance each time a repository for the aggregate type is opened
 */
@FunctionalInterface
public interface ReadModelBuilderFactory {
    /**
     * @param context the context the builder belongs to
     * @param bus     the bus the repository publishes to
     * @return a new {@link ReadModelBuilder}
     */
    ReadModelBuilder create(DomainContext context, NotificationEventBus bus);
}
