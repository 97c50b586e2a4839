package dk.cloudcreate.domainkit.eventsourced.aggregates.bus;

import dk.cloudcreate.domainkit.eventsourced.aggregates.DomainEvent;
import reactor.core.Disposable;

import java.util.function.Consumer;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * Publish/subscribe channel for {@link DomainEvent}'s
 *
 * @see LocalNotificationEventBus
 * @see ReadModelBuildingEventBus
 */
public interface NotificationEventBus {
    /**
     * Publish the event to all subscribers
     *
     * @param event the event to publish
     */
    void publish(DomainEvent event);

    /**
     * Subscribe to all events published on this bus
     *
     * @param subscriber the subscriber
     * @return the subscription - {@link Disposable#dispose()} it to unsubscribe
     */
    Disposable subscribe(Consumer<DomainEvent> subscriber);

    /**
     * Subscribe to the events published on this bus that are instances of <code>eventType</code>
     *
     * @param eventType  the type of event the subscriber is interested in
     * @param subscriber the subscriber
     * @param <E>        the type of event
     * @return the subscription - {@link Disposable#dispose()} it to unsubscribe
     */
    default <E extends DomainEvent> Disposable subscribe(Class<E> eventType, Consumer<E> subscriber) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(subscriber, "No subscriber provided");
        return subscribe(event -> {
            if (eventType.isInstance(event)) {
                subscriber.accept(eventType.cast(event));
            }
        });
    }
}
