package dk.cloudcreate.domainkit.eventsourced.aggregates;

import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.NotificationEventBus;

/**
 * Marker interface for everything that can be published on a {@link NotificationEventBus}
 *
 * @see AggregateEvent
 * @see dk.cloudcreate.domainkit.eventsourced.aggregates.repository.ReadModelChangedEvent
 */
public interface DomainEvent {
}
