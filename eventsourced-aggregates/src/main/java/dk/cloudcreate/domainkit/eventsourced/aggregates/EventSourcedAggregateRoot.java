package dk.cloudcreate.domainkit.eventsourced.aggregates;

import dk.cloudcreate.domainkit.eventsourced.aggregates.reflection.EventHandlerInvoker;

import java.util.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * A specialized and opinionated mutable event sourced {@link AggregateRoot} design.<br>
 * This base class is designed to work with Class based events that inherit from {@link AggregateEvent}.
 * <p>
 * You only have to supply the aggregate id, through {@link AggregateEvent#aggregateId()}, on the FIRST/initial event
 * that's being applied to the aggregate using the {@link #apply(AggregateEvent)} method.<br>
 * Every consecutive event applied will automatically have its {@link AggregateEvent#aggregateId(Object)} method called IF it doesn't already have a value.<br>
 * The aggregate also keeps track of the {@link AggregateEvent#version()} and will set it for you and ensure that it's consecutively growing.
 * <p>
 * State changes are performed by private methods annotated with {@link EventHandler}:
 * <pre>{@code
 * public class Order extends EventSourcedAggregateRoot<OrderId, Order> {
 *     private boolean accepted;
 *
 *     public void accept() {
 *         if (accepted) return;
 *         apply(new OrderAccepted());
 *     }
 *
 *     @EventHandler
 *     private void on(OrderAccepted e) {
 *         accepted = true;
 *     }
 * }
 * }</pre>
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class EventSourcedAggregateRoot<ID, AGGREGATE_TYPE extends EventSourcedAggregateRoot<ID, AGGREGATE_TYPE>> implements AggregateRoot<ID>, EventSourced<ID> {
    public static final long NO_EVENTS_HAVE_BEEN_APPLIED = 0;

    private EventHandlerInvoker      invoker;
    private ID                       aggregateId;
    private List<AggregateEvent<ID>> uncommittedEvents;
    /**
     * One based version of the last applied event
     */
    private Long                     version;
    private boolean                  hasBeenRehydrated;
    private boolean                  isRehydrating;

    public EventSourcedAggregateRoot() {
        initialize();
    }

    /**
     * Initialize the aggregate, e.g. setting up the {@link EventHandlerInvoker}
     */
    protected void initialize() {
        invoker = new EventHandlerInvoker(this, EventHandler.class);
    }

    /**
     * Effectively performs a leftFold over the previously persisted events related to this aggregate instance.<br>
     * The versions of the events must continue the current {@link #version()} without gaps, which means that replaying
     * a prefix of the history followed by the remaining suffix yields the same state as replaying the full history
     *
     * @param history the previously persisted events, aka. the aggregate's history
     */
    @Override
    public void loadFromEvents(List<? extends AggregateEvent<ID>> history) {
        requireNonNull(history, "You must provide a history");
        isRehydrating = true;
        try {
            for (var event : history) {
                requireNonNull(event, "A historic event cannot be null");
                if (aggregateId == null) {
                    aggregateId = event.aggregateId();
                    requireNonNull(aggregateId, msg("The first historic Event '{}' applied to Aggregate '{}' didn't contain an aggregateId",
                                                    event.getClass().getName(),
                                                    this.getClass().getName()));
                }
                var expectedVersion = version() + 1;
                if (event.version() != expectedVersion) {
                    throw new AggregateException(msg("Cannot rehydrate Aggregate '{}' with id '{}': expected historic Event '{}' to have version {} but it had version {}",
                                                     this.getClass().getName(),
                                                     aggregateId,
                                                     event.getClass().getName(),
                                                     expectedVersion,
                                                     event.version()));
                }
                applyEventToTheAggregate(event);
                version = event.version();
            }
        } finally {
            isRehydrating = false;
        }
        hasBeenRehydrated = true;
    }

    /**
     * Convenience variant of {@link #loadFromEvents(List)} that returns the aggregate itself
     *
     * @param history the previously persisted events
     * @return the same aggregate instance (self)
     */
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE rehydrate(List<? extends AggregateEvent<ID>> history) {
        loadFromEvents(history);
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Apply a new non persisted/uncommitted event to this aggregate instance.<br>
     * If it is the very FIRST event that is being applied then {@link AggregateEvent#aggregateId()} MUST return the id of the aggregate the event relates to<br>
     * The event is assigned the next version and (if it doesn't have one) a random event id
     *
     * @param event the event to apply
     * @throws InitialEventIsMissingAggregateIdException if the first event applied doesn't carry the aggregate id
     */
    protected void apply(AggregateEvent<ID> event) {
        requireNonNull(event, "You must supply an event");
        ID eventAggregateId = event.aggregateId();
        if (this.aggregateId == null) {
            this.aggregateId = eventAggregateId;
            if (this.aggregateId == null) {
                throw new InitialEventIsMissingAggregateIdException(msg("The first Event '{}' applied to Aggregate '{}' didn't contain an aggregateId",
                                                                        event.getClass().getName(),
                                                                        this.getClass().getName()));
            }
        }
        if (eventAggregateId == null) {
            event.aggregateId(aggregateId);
        } else {
            requireTrue(Objects.equals(eventAggregateId, this.aggregateId), msg("Aggregate Id's do not match! Cannot apply Event '{}' with aggregateId '{}' to Aggregate '{}' with aggregateId '{}'",
                                                                                event.getClass().getName(),
                                                                                eventAggregateId,
                                                                                this.getClass().getName(),
                                                                                this.aggregateId));
        }
        var nextVersion = version() + 1;
        event.version(nextVersion);
        if (event.eventId() == null) {
            event.eventId(UUID.randomUUID());
        }
        applyEventToTheAggregate(event);
        version = nextVersion;
        _uncommittedEvents().add(event);
    }

    @Override
    public ID aggregateId() {
        requireNonNull(aggregateId, "The aggregate id has not been set on the Aggregate and not supplied using one of the Events applied to it. At least the first event MUST supply it");
        return aggregateId;
    }

    /**
     * Has {@link #loadFromEvents(List)} been used
     */
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * Is the event being supplied to {@link #applyEventToTheAggregate(AggregateEvent)} a historic event
     */
    protected final boolean isRehydrating() {
        return isRehydrating;
    }

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change to the aggregate<br>
     * The default implementation will automatically call any (private) methods annotated with {@link EventHandler}
     *
     * @param event the event to apply to the aggregate
     */
    protected void applyEventToTheAggregate(AggregateEvent<ID> event) {
        if (invoker == null) {
            // Instance was created by Objenesis
            initialize();
        }
        invoker.invoke(event, unmatchedEvent -> {
            // Aggregates don't necessarily handle every event
        });
    }

    /**
     * @return the version of the last applied event or {@link #NO_EVENTS_HAVE_BEEN_APPLIED}
     */
    @Override
    public long version() {
        if (version == null) {
            // Objenesis created instances don't have their fields initialized
            version = NO_EVENTS_HAVE_BEEN_APPLIED;
        }
        return version;
    }

    @Override
    public List<AggregateEvent<ID>> uncommittedEvents() {
        return _uncommittedEvents();
    }

    @Override
    public void markChangesAsCommitted() {
        uncommittedEvents = new ArrayList<>();
    }

    private List<AggregateEvent<ID>> _uncommittedEvents() {
        if (uncommittedEvents == null) {
            uncommittedEvents = new ArrayList<>();
        }
        return uncommittedEvents;
    }
}
