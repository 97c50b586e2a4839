package dk.cloudcreate.domainkit.eventsourced.aggregates.context;

import dk.cloudcreate.domainkit.common.transaction.UnitOfWorkScope;
import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.command.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.repository.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.*;
import org.slf4j.*;
import reactor.core.*;

import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * The composition root of the domain: it knows the registered aggregate types, their {@link SnapshotRepository} factories and
 * {@link ReadModelBuilder} factories, and wires short lived {@link AggregateRepository} instances from them.
 * <pre>{@code
 * var store         = new InMemoryEventStore();
 * var domainContext = new DomainContext(store, store, new JacksonEventSerializer(), new LocalNotificationEventBus("Domain"));
 * domainContext.registerAggregateType(AggregateTypeConfiguration.eventSourced(ORDERS, Order.class));
 * domainContext.registerBuilder(ORDERS, (context, bus) -> new OrderSummaryBuilder(summaries));
 *
 * try (var scope = domainContext.beginUnitOfWork();
 *      var orders = domainContext.getAggregateRepository(Order.class)) {
 *     var order = orders.load(orderId);
 *     order.accept();
 *     orders.save(order);
 *     scope.commit();
 * }
 * }</pre>
 * Registration is expected to happen at startup. {@link #beginUnitOfWork()} can be overridden by contexts whose stores support transactions.
 */
public class DomainContext {
    private static final Logger log = LoggerFactory.getLogger(DomainContext.class);

    private final EventStoreRepository                                        eventStore;
    private final AggregateManifestRepository                                 manifest;
    private final EventSerializer                                             eventSerializer;
    private final NotificationEventBus                                        eventBus;
    private final ConcurrentMap<Class<?>, AggregateTypeConfiguration<?, ?>>   aggregateTypeConfigurations = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregateType, SnapshotRepositoryFactory>     snapshotRepositoryFactories = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregateType, List<ReadModelBuilderFactory>> readModelBuilderFactories   = new ConcurrentHashMap<>();

    /**
     * @param eventStore      the store for the events of {@link PersistenceStrategy#EVENT_SOURCED} aggregates
     * @param manifest        the manifest paired with the <code>eventStore</code>
     * @param eventSerializer the serializer used to convert events to and from the form kept in the <code>eventStore</code>
     * @param eventBus        the default bus that persisted events are published on
     */
    public DomainContext(EventStoreRepository eventStore,
                         AggregateManifestRepository manifest,
                         EventSerializer eventSerializer,
                         NotificationEventBus eventBus) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.manifest = requireNonNull(manifest, "No manifest provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.eventBus = requireNonNull(eventBus, "No eventBus provided");
    }

    /**
     * Register an aggregate type. Registering the same implementation type again replaces the previous configuration
     *
     * @param configuration the aggregate type configuration
     * @return this context
     */
    public DomainContext registerAggregateType(AggregateTypeConfiguration<?, ?> configuration) {
        requireNonNull(configuration, "No configuration provided");
        aggregateTypeConfigurations.values()
                                   .stream()
                                   .filter(existing -> existing.aggregateType.equals(configuration.aggregateType) &&
                                           existing.aggregateImplementationType != configuration.aggregateImplementationType)
                                   .findFirst()
                                   .ifPresent(existing -> {
                                       throw new IllegalArgumentException(msg("Aggregate type '{}' is already registered for '{}'",
                                                                              existing.aggregateType,
                                                                              existing.aggregateImplementationType.getName()));
                                   });
        log.debug("Registering {}", configuration);
        aggregateTypeConfigurations.put(configuration.aggregateImplementationType, configuration);
        return this;
    }

    /**
     * Register the factory for the {@link SnapshotRepository} of an aggregate type. A later registration for the same aggregate type
     * replaces the earlier one
     *
     * @param aggregateType the aggregate type
     * @param factory       the factory
     * @return this context
     */
    public DomainContext registerSnapshot(AggregateType aggregateType, SnapshotRepositoryFactory factory) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(factory, "No factory provided");
        var previous = snapshotRepositoryFactories.put(aggregateType, factory);
        if (previous != null) {
            log.debug("Replaced the SnapshotRepository factory for aggregate type '{}'", aggregateType);
        } else {
            log.debug("Registered a SnapshotRepository factory for aggregate type '{}'", aggregateType);
        }
        return this;
    }

    /**
     * Add a {@link ReadModelBuilder} factory for an aggregate type. Builders are invoked in the order their factories were registered
     *
     * @param aggregateType the aggregate type
     * @param factory       the factory
     * @return this context
     */
    public DomainContext registerBuilder(AggregateType aggregateType, ReadModelBuilderFactory factory) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(factory, "No factory provided");
        readModelBuilderFactories.computeIfAbsent(aggregateType, type -> new CopyOnWriteArrayList<>()).add(factory);
        log.debug("Registered a ReadModelBuilder factory for aggregate type '{}'", aggregateType);
        return this;
    }

    /**
     * Get the configuration registered for the aggregate implementation type
     *
     * @throws UnknownAggregateTypeException if the type hasn't been registered
     */
    @SuppressWarnings("unchecked")
    public <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateTypeConfiguration<ID, AGGREGATE_TYPE> getAggregateTypeConfiguration(Class<AGGREGATE_TYPE> aggregateImplementationType) {
        requireNonNull(aggregateImplementationType, "No aggregateImplementationType provided");
        var configuration = aggregateTypeConfigurations.get(aggregateImplementationType);
        if (configuration == null) {
            throw new UnknownAggregateTypeException(msg("Aggregate implementation type '{}' hasn't been registered", aggregateImplementationType.getName()));
        }
        return (AggregateTypeConfiguration<ID, AGGREGATE_TYPE>) configuration;
    }

    /**
     * Open a repository for the aggregate implementation type that publishes persisted events on the context's default bus
     *
     * @see #getAggregateRepository(Class, NotificationEventBus)
     */
    public <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateRepository<ID, AGGREGATE_TYPE> getAggregateRepository(Class<AGGREGATE_TYPE> aggregateImplementationType) {
        return getAggregateRepository(aggregateImplementationType, eventBus);
    }

    /**
     * Open a repository for the aggregate implementation type.<br>
     * The repository publishes through a new {@link ReadModelBuildingEventBus} around <code>bus</code>, so the read model builders
     * registered for the aggregate type see every saved event before the subscribers of <code>bus</code> do.<br>
     * If the repository is an {@link ObservableRepository} its changes are republished on <code>bus</code> until the repository is closed.
     *
     * @param aggregateImplementationType the aggregate implementation type
     * @param bus                         the bus persisted events are published on
     * @return a new repository that must be closed after use
     * @throws UnknownAggregateTypeException if the type hasn't been registered
     */
    @SuppressWarnings("unchecked")
    public <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> AggregateRepository<ID, AGGREGATE_TYPE> getAggregateRepository(Class<AGGREGATE_TYPE> aggregateImplementationType,
                                                                                                                          NotificationEventBus bus) {
        requireNonNull(bus, "No bus provided");
        AggregateTypeConfiguration<ID, AGGREGATE_TYPE> configuration = getAggregateTypeConfiguration(aggregateImplementationType);
        var readModelBuildingEventBus = new ReadModelBuildingEventBus(this, configuration.aggregateType, bus);

        AggregateRepository<ID, AGGREGATE_TYPE> repository;
        switch (configuration.persistenceStrategy) {
            case EVENT_SOURCED:
                repository = new EventSourcedAggregateRepository<>(configuration,
                                                                   eventSerializer,
                                                                   eventStore,
                                                                   manifest,
                                                                   readModelBuildingEventBus);
                break;
            case SNAPSHOT:
                repository = new SnapshotAggregateRepository<>(configuration,
                                                               getSnapshotRepository(configuration.aggregateType).map(snapshotRepository -> (SnapshotRepository<ID, AGGREGATE_TYPE>) snapshotRepository),
                                                               readModelBuildingEventBus);
                break;
            default:
                throw new IllegalStateException(msg("Unsupported persistence strategy {}", configuration.persistenceStrategy));
        }

        if (repository instanceof ObservableRepository) {
            subscribeToChanges((ObservableRepository) repository, bus);
        }
        log.trace("Opened {}", repository);
        return repository;
    }

    /**
     * Create a new {@link SnapshotRepository} for the aggregate type
     *
     * @return the {@link SnapshotRepository} or {@link Optional#empty()} if no factory has been registered for the aggregate type
     */
    public Optional<SnapshotRepository<?, ?>> getSnapshotRepository(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return Optional.ofNullable(snapshotRepositoryFactories.get(aggregateType))
                       .map(factory -> factory.create(this));
    }

    /**
     * Create new instances of the {@link ReadModelBuilder}'s registered for the aggregate type.<br>
     * Changes announced by builders that implement {@link ObservableRepository} are republished on <code>bus</code>; the caller owns
     * the subscriptions through <code>changeSubscriptions</code>
     *
     * @param aggregateType       the aggregate type
     * @param bus                 the bus the builders are created for
     * @param changeSubscriptions receives the subscriptions to the builders' changes
     * @return the builders in registration order (empty if none have been registered)
     */
    public List<ReadModelBuilder> getReadModelBuilders(AggregateType aggregateType, NotificationEventBus bus, Disposable.Composite changeSubscriptions) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(bus, "No bus provided");
        requireNonNull(changeSubscriptions, "No changeSubscriptions provided");
        var factories = readModelBuilderFactories.getOrDefault(aggregateType, List.of());
        var builders  = new ArrayList<ReadModelBuilder>(factories.size());
        for (var factory : factories) {
            var builder = requireNonNull(factory.create(this, bus), msg("A ReadModelBuilderFactory for aggregate type '{}' returned null", aggregateType));
            if (builder instanceof ObservableRepository) {
                changeSubscriptions.add(subscribeToChanges((ObservableRepository) builder, bus));
            }
            builders.add(builder);
        }
        return builders;
    }

    /**
     * Variant of {@link #getReadModelBuilders(AggregateType, NotificationEventBus, Disposable.Composite)} where the returned
     * {@link ReadModelBuilders} own the subscriptions to the builders' changes. Close it to end them
     */
    public ReadModelBuilders getReadModelBuilders(AggregateType aggregateType, NotificationEventBus bus) {
        var changeSubscriptions = Disposables.composite();
        return new ReadModelBuilders(getReadModelBuilders(aggregateType, bus, changeSubscriptions), changeSubscriptions);
    }

    /**
     * Start a new unit of work. The default implementation returns a {@link NoOpUnitOfWorkScope}
     */
    public UnitOfWorkScope beginUnitOfWork() {
        return new NoOpUnitOfWorkScope();
    }

    /**
     * Create a {@link CommandExecutor} for the aggregate implementation type
     *
     * @throws UnknownAggregateTypeException if the type hasn't been registered
     */
    public <ID, AGGREGATE_TYPE extends AggregateRoot<ID>> CommandExecutor<ID, AGGREGATE_TYPE> newCommandExecutor(Class<AGGREGATE_TYPE> aggregateImplementationType) {
        getAggregateTypeConfiguration(aggregateImplementationType);
        return new DomainCommandExecutor<>(this, aggregateImplementationType);
    }

    public NotificationEventBus getEventBus() {
        return eventBus;
    }

    public EventStoreRepository getEventStore() {
        return eventStore;
    }

    public AggregateManifestRepository getManifest() {
        return manifest;
    }

    public EventSerializer getEventSerializer() {
        return eventSerializer;
    }

    private Disposable subscribeToChanges(ObservableRepository observableRepository, NotificationEventBus bus) {
        return observableRepository.changes()
                                   .subscribe(change -> bus.publish(change.asDomainEvent()),
                                              error -> log.error(msg("The changes of {} failed", observableRepository.getClass().getName()), error));
    }
}
