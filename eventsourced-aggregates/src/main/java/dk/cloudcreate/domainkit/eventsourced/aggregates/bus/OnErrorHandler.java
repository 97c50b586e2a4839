package dk.cloudcreate.domainkit.eventsourced.aggregates.bus;

import dk.cloudcreate.domainkit.eventsourced.aggregates.DomainEvent;

import java.util.function.Consumer;

/**
 * Called by the {@link LocalNotificationEventBus} when a subscriber fails to handle an event
 */
@FunctionalInterface
public interface OnErrorHandler {
    void handle(Consumer<DomainEvent> failingSubscriber, DomainEvent event, Exception error);
}
