package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.NotificationEventBus;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.domainkit.common.FailFast.*;

/**
 * {@link AggregateRepository} for {@link PersistenceStrategy#EVENT_SOURCED} aggregates.<br>
 * Loading an aggregate replays its stored events through {@link EventSourced#loadFromEvents(List)}.<br>
 * Saving an aggregate:
 * <ol>
 *     <li>does nothing if the aggregate has no uncommitted events</li>
 *     <li>atomically (see {@link EventStoreRepository#executeAtomically(Runnable)}) verifies that the last stored event has the version
 *     the aggregate was loaded with, advances the {@link AggregateManifestRepository} and appends the uncommitted events</li>
 *     <li>publishes the events, in order, on the {@link NotificationEventBus} (normally a {@link dk.cloudcreate.domainkit.eventsourced.aggregates.bus.ReadModelBuildingEventBus})</li>
 *     <li>marks the aggregate's changes as committed</li>
 * </ol>
 * A stale aggregate results in a {@link ConcurrencyException} and nothing is written or published.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public class EventSourcedAggregateRepository<ID, AGGREGATE_TYPE extends AggregateRoot<ID>> implements AggregateRepository<ID, AGGREGATE_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedAggregateRepository.class);

    private final AggregateTypeConfiguration<ID, AGGREGATE_TYPE> configuration;
    private final EventSerializer                                eventSerializer;
    private final EventStoreRepository                           eventStore;
    private final AggregateManifestRepository                    manifest;
    private final NotificationEventBus                           eventBus;
    private       boolean                                        closed;

    public EventSourcedAggregateRepository(AggregateTypeConfiguration<ID, AGGREGATE_TYPE> configuration,
                                           EventSerializer eventSerializer,
                                           EventStoreRepository eventStore,
                                           AggregateManifestRepository manifest,
                                           NotificationEventBus eventBus) {
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.manifest = requireNonNull(manifest, "No manifest provided");
        this.eventBus = requireNonNull(eventBus, "No eventBus provided");
        requireTrue(configuration.persistenceStrategy == PersistenceStrategy.EVENT_SOURCED,
                    "An EventSourcedAggregateRepository requires an aggregate type configured as EVENT_SOURCED");
    }

    @Override
    public AGGREGATE_TYPE newInstance() {
        return configuration.newAggregateInstance();
    }

    @SuppressWarnings("unchecked")
    @Override
    public Optional<AGGREGATE_TYPE> getById(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireOpen();
        log.trace("Trying to load {} with id '{}'", aggregateImplementationType().getName(), aggregateId);
        var storedEvents = eventStore.getAllAggregateEvents(aggregateId);
        if (storedEvents.isEmpty()) {
            log.trace("Didn't find a {} with id '{}'", aggregateImplementationType().getName(), aggregateId);
            return Optional.empty();
        }

        var history = storedEvents.stream()
                                  .map(storedEvent -> {
                                      var event = (AggregateEvent<ID>) requireMustBeInstanceOf(eventSerializer.deserializeFromString(storedEvent.event()),
                                                                                                AggregateEvent.class);
                                      event.aggregateId(aggregateId);
                                      return event;
                                  })
                                  .collect(Collectors.toList());
        var aggregate = newInstance();
        ((EventSourced<ID>) aggregate).loadFromEvents(history);
        log.debug("Found {} with id '{}' and version {}", aggregateImplementationType().getName(), aggregateId, aggregate.version());
        return Optional.of(aggregate);
    }

    /**
     * @throws UnsupportedOperationException always
     */
    @Override
    public List<AGGREGATE_TYPE> getAll() {
        throw new UnsupportedOperationException("Event sourced aggregates can't be enumerated");
    }

    @Override
    public void save(AGGREGATE_TYPE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        requireOpen();
        var uncommittedEvents = List.copyOf(aggregate.uncommittedEvents());
        if (uncommittedEvents.isEmpty()) {
            log.trace("No changes detected for {} - nothing to save", aggregateImplementationType().getName());
            return;
        }

        var aggregateId     = aggregate.aggregateId();
        var expectedVersion = uncommittedEvents.get(0).version() - 1;
        var newVersion      = uncommittedEvents.get(uncommittedEvents.size() - 1).version();
        eventStore.executeAtomically(() -> {
            long actualVersion = eventStore.getLastAggregateEvent(aggregateId)
                                           .map(StoredEvent::version)
                                           .orElse(0L);
            if (actualVersion != expectedVersion) {
                log.debug("Concurrency conflict for {} with id '{}': expected version {} but found {}",
                          aggregateImplementationType().getName(),
                          aggregateId,
                          expectedVersion,
                          actualVersion);
                throw new ConcurrencyException(aggregateId, aggregateImplementationType(), expectedVersion, actualVersion);
            }
            manifest.updateManifest(aggregateId, expectedVersion, newVersion);
            uncommittedEvents.forEach(event -> eventStore.save(toStoredEvent(aggregateId, event)));
        });
        log.debug("Persisted {} event(s) related to {} with id '{}' (version {} -> {})",
                  uncommittedEvents.size(),
                  aggregateImplementationType().getName(),
                  aggregateId,
                  expectedVersion,
                  newVersion);

        uncommittedEvents.forEach(eventBus::publish);
        aggregate.markChangesAsCommitted();
    }

    /**
     * @throws UnsupportedOperationException always
     */
    @Override
    public void delete(AGGREGATE_TYPE aggregate) {
        throw new UnsupportedOperationException("Event sourced aggregates can't be deleted");
    }

    /**
     * @throws UnsupportedOperationException always
     */
    @Override
    public void deleteId(ID aggregateId) {
        throw new UnsupportedOperationException("Event sourced aggregates can't be deleted");
    }

    @Override
    public AggregateType aggregateType() {
        return configuration.aggregateType;
    }

    @Override
    public Class<AGGREGATE_TYPE> aggregateImplementationType() {
        return configuration.aggregateImplementationType;
    }

    /**
     * Closes the {@link NotificationEventBus} (if it's {@link AutoCloseable}) and then the {@link EventStoreRepository}
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.trace("Closing repository for {}", aggregateImplementationType().getName());
        try {
            if (eventBus instanceof AutoCloseable) {
                ((AutoCloseable) eventBus).close();
            }
        } catch (Exception e) {
            throw new AggregateException("Failed to close the event bus", e);
        } finally {
            eventStore.close();
        }
    }

    @Override
    public String toString() {
        return "EventSourcedAggregateRepository{" +
                "aggregateType=" + aggregateType() +
                ", aggregateImplementationType=" + aggregateImplementationType().getName() +
                '}';
    }

    private StoredEvent toStoredEvent(ID aggregateId, AggregateEvent<ID> event) {
        return eventStore.newStoredEvent()
                         .aggregateId(String.valueOf(aggregateId))
                         .eventId(event.eventId())
                         .version(event.version())
                         .eventType(event.getClass().getName())
                         .event(eventSerializer.serializeToString(event));
    }

    private void requireOpen() {
        requireFalse(closed, "The repository has been closed");
    }
}
