package dk.cloudcreate.domainkit.eventsourced.aggregates.bus;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext;
import dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel.*;
import org.slf4j.*;
import reactor.core.Disposable;

import java.util.*;
import java.util.function.Consumer;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * {@link NotificationEventBus} decorator that feeds every published {@link AggregateEvent} to the {@link ReadModelBuilder}'s registered
 * for one aggregate type, in registration order, before passing the event on to the wrapped bus.<br>
 * A failing {@link ReadModelBuilder} stops the delivery and the exception propagates to the publisher.
 * <p>
 * One instance is created per repository and closed together with the repository, which closes the builders and
 * disposes the subscriptions to their changes
 */
public class ReadModelBuildingEventBus implements NotificationEventBus, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReadModelBuildingEventBus.class);

    private final AggregateType        aggregateType;
    private final NotificationEventBus bus;
    private final ReadModelBuilders    readModelBuilders;

    /**
     * @param context       the context that knows the {@link ReadModelBuilder}'s registered for the <code>aggregateType</code>
     * @param aggregateType the aggregate type whose events are published on this bus
     * @param bus           the wrapped bus
     */
    public ReadModelBuildingEventBus(DomainContext context, AggregateType aggregateType, NotificationEventBus bus) {
        requireNonNull(context, "No context provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.bus = requireNonNull(bus, "No bus provided");
        this.readModelBuilders = context.getReadModelBuilders(aggregateType, bus);
        log.trace("Created for aggregate type '{}' with {} read model builder(s)", aggregateType, readModelBuilders.size());
    }

    @Override
    public void publish(DomainEvent event) {
        requireNonNull(event, "No event provided");
        if (event instanceof AggregateEvent) {
            var aggregateEvent = (AggregateEvent<?>) event;
            for (var readModelBuilder : readModelBuilders) {
                log.trace("[{}] Handing {} to {}", aggregateType, event.getClass().getSimpleName(), readModelBuilder.getClass().getSimpleName());
                readModelBuilder.handle(aggregateEvent);
            }
        }
        bus.publish(event);
    }

    @Override
    public Disposable subscribe(Consumer<DomainEvent> subscriber) {
        return bus.subscribe(subscriber);
    }

    public List<ReadModelBuilder> readModelBuilders() {
        return readModelBuilders;
    }

    /**
     * Disposes the subscriptions to the builders' changes and closes the builders. The wrapped bus is left open
     */
    @Override
    public void close() {
        if (readModelBuilders.isClosed()) {
            return;
        }
        log.trace("[{}] Closing", aggregateType);
        readModelBuilders.close();
    }
}
