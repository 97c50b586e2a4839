package dk.cloudcreate.domainkit.eventsourced.aggregates;

import java.util.UUID;

/**
 * Base class for the events that describe a single state transition of an {@link AggregateRoot}.<br>
 * Concrete events add their payload as fields:
 * <pre>{@code
 * public class ProductAddedToOrder extends AggregateEvent<OrderId> {
 *     private ProductId productId;
 *     private int       quantity;
 *     ...
 * }
 * }</pre>
 * The {@link EventSourcedAggregateRoot} assigns the {@link #version()}, the {@link #eventId()} and (for all but
 * the first event) the {@link #aggregateId()} when the event is applied, so concrete events only have to
 * supply the aggregate id on the initial event.<br>
 * Once an event has been persisted it must never be changed.
 *
 * @param <ID> the aggregate id type
 */
public abstract class AggregateEvent<ID> implements DomainEvent {
    private ID   aggregateId;
    /**
     * 1-based and contiguous per aggregate instance
     */
    private long version;
    private UUID eventId;

    protected AggregateEvent() {
    }

    protected AggregateEvent(ID aggregateId) {
        this.aggregateId = aggregateId;
    }

    /**
     * The id of the aggregate this event relates to
     */
    public ID aggregateId() {
        return aggregateId;
    }

    public void aggregateId(ID aggregateId) {
        this.aggregateId = aggregateId;
    }

    /**
     * The version of the aggregate after this event has been applied
     */
    public long version() {
        return version;
    }

    public void version(long version) {
        this.version = version;
    }

    /**
     * The unique id of this event
     */
    public UUID eventId() {
        return eventId;
    }

    public void eventId(UUID eventId) {
        this.eventId = eventId;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                ", eventId=" + eventId +
                '}';
    }
}
