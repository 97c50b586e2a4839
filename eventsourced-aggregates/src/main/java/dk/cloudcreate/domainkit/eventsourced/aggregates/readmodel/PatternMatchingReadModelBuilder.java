package dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.reflection.EventHandlerInvoker;
import org.slf4j.*;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * {@link ReadModelBuilder} that routes each event to the method, annotated with {@link EventHandler}, whose single parameter
 * best matches the type of the event.<br>
 * Events without a matching method are passed to {@link #handleUnmatchedEvent(AggregateEvent)}, which ignores them by default.
 * <pre>{@code
 * public class OrderSummaryBuilder extends PatternMatchingReadModelBuilder {
 *     @EventHandler
 *     private void on(OrderAdded e) {
 *         ...
 *     }
 *
 *     @EventHandler
 *     private void on(OrderAccepted e) {
 *         ...
 *     }
 * }
 * }</pre>
 */
public abstract class PatternMatchingReadModelBuilder implements ReadModelBuilder {
    private static final Logger log = LoggerFactory.getLogger(PatternMatchingReadModelBuilder.class);

    private final EventHandlerInvoker invoker;

    protected PatternMatchingReadModelBuilder() {
        invoker = new EventHandlerInvoker(this, EventHandler.class);
    }

    @Override
    public void handle(AggregateEvent<?> event) {
        requireNonNull(event, "No event provided");
        invoker.invoke(event, unmatchedEvent -> handleUnmatchedEvent((AggregateEvent<?>) unmatchedEvent));
    }

    /**
     * Override this method to handle events that don't match any {@link EventHandler} method
     *
     * @param event the unmatched event
     */
    protected void handleUnmatchedEvent(AggregateEvent<?> event) {
        log.trace("{} has no handler for {}", getClass().getSimpleName(), event.getClass().getSimpleName());
    }
}
