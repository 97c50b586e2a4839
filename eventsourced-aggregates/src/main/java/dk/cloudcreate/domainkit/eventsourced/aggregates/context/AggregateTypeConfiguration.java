package dk.cloudcreate.domainkit.eventsourced.aggregates.context;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;

import java.util.Objects;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Declares an aggregate type to the {@link DomainContext}: its stable {@link AggregateType} name, its implementation class,
 * how new instances are created and how it's persisted.
 * <pre>{@code
 * domainContext.registerAggregateType(AggregateTypeConfiguration.eventSourced(AggregateType.of("Orders"), Order.class));
 * }</pre>
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public final class AggregateTypeConfiguration<ID, AGGREGATE_TYPE extends AggregateRoot<ID>> {
    public final AggregateType            aggregateType;
    public final Class<AGGREGATE_TYPE>    aggregateImplementationType;
    public final PersistenceStrategy      persistenceStrategy;
    public final AggregateInstanceFactory aggregateInstanceFactory;

    public AggregateTypeConfiguration(AggregateType aggregateType,
                                      Class<AGGREGATE_TYPE> aggregateImplementationType,
                                      PersistenceStrategy persistenceStrategy,
                                      AggregateInstanceFactory aggregateInstanceFactory) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "No aggregateImplementationType provided");
        this.persistenceStrategy = requireNonNull(persistenceStrategy, "No persistenceStrategy provided");
        this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "No aggregateInstanceFactory provided");
        if (persistenceStrategy == PersistenceStrategy.EVENT_SOURCED) {
            requireTrue(EventSourced.class.isAssignableFrom(aggregateImplementationType),
                        msg("Aggregate type '{}' ({}) is configured as {} but doesn't implement {}",
                            aggregateType,
                            aggregateImplementationType.getName(),
                            persistenceStrategy,
                            EventSourced.class.getSimpleName()));
        }
    }

    /**
     * Configure an {@link PersistenceStrategy#EVENT_SOURCED} aggregate type whose instances are created using their default constructor
     */
    public static <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateTypeConfiguration<ID, AGGREGATE_TYPE> eventSourced(AggregateType aggregateType,
                                                                                                                          Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return eventSourced(aggregateType, aggregateImplementationType, AggregateInstanceFactory.defaultConstructorFactory());
    }

    public static <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateTypeConfiguration<ID, AGGREGATE_TYPE> eventSourced(AggregateType aggregateType,
                                                                                                                          Class<AGGREGATE_TYPE> aggregateImplementationType,
                                                                                                                          AggregateInstanceFactory aggregateInstanceFactory) {
        return new AggregateTypeConfiguration<>(aggregateType, aggregateImplementationType, PersistenceStrategy.EVENT_SOURCED, aggregateInstanceFactory);
    }

    /**
     * Configure a {@link PersistenceStrategy#SNAPSHOT} aggregate type whose instances are created using their default constructor
     */
    public static <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateTypeConfiguration<ID, AGGREGATE_TYPE> snapshot(AggregateType aggregateType,
                                                                                                                      Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return snapshot(aggregateType, aggregateImplementationType, AggregateInstanceFactory.defaultConstructorFactory());
    }

    public static <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateTypeConfiguration<ID, AGGREGATE_TYPE> snapshot(AggregateType aggregateType,
                                                                                                                      Class<AGGREGATE_TYPE> aggregateImplementationType,
                                                                                                                      AggregateInstanceFactory aggregateInstanceFactory) {
        return new AggregateTypeConfiguration<>(aggregateType, aggregateImplementationType, PersistenceStrategy.SNAPSHOT, aggregateInstanceFactory);
    }

    /**
     * Create a new blank aggregate instance using the {@link #aggregateInstanceFactory}
     */
    public AGGREGATE_TYPE newAggregateInstance() {
        return aggregateInstanceFactory.create(aggregateImplementationType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateTypeConfiguration)) return false;
        var that = (AggregateTypeConfiguration<?, ?>) o;
        return aggregateType.equals(that.aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType);
    }

    @Override
    public String toString() {
        return "AggregateTypeConfiguration{" +
                "aggregateType=" + aggregateType +
                ", aggregateImplementationType=" + aggregateImplementationType.getName() +
                ", persistenceStrategy=" + persistenceStrategy +
                '}';
    }
}
