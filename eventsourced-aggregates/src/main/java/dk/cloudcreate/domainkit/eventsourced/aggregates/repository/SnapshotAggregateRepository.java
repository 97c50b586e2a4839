package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.NotificationEventBus;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.*;
import org.slf4j.*;
import reactor.core.publisher.*;

import java.util.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * {@link AggregateRepository} for {@link PersistenceStrategy#SNAPSHOT} aggregates, which delegates the storage of the aggregate state to
 * the {@link SnapshotRepository} registered for the aggregate type.<br>
 * Every save or delete is announced through {@link #changes()}. The uncommitted events of a saved aggregate are published on the
 * {@link NotificationEventBus} after the state has been stored.
 * <p>
 * If no {@link SnapshotRepository} has been registered for the aggregate type the repository can still be opened, but every operation
 * that needs the {@link SnapshotRepository} fails with an {@link AggregateException}
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public class SnapshotAggregateRepository<ID, AGGREGATE_TYPE extends AggregateRoot<ID>> implements AggregateRepository<ID, AGGREGATE_TYPE>, ObservableRepository {
    private static final Logger log = LoggerFactory.getLogger(SnapshotAggregateRepository.class);

    private final AggregateTypeConfiguration<ID, AGGREGATE_TYPE>   configuration;
    private final Optional<SnapshotRepository<ID, AGGREGATE_TYPE>> snapshotRepository;
    private final NotificationEventBus                             eventBus;
    private final Sinks.Many<DataChange>                           changes = Sinks.many().multicast().directBestEffort();
    private       boolean                                          closed;

    public SnapshotAggregateRepository(AggregateTypeConfiguration<ID, AGGREGATE_TYPE> configuration,
                                       Optional<SnapshotRepository<ID, AGGREGATE_TYPE>> snapshotRepository,
                                       NotificationEventBus eventBus) {
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.snapshotRepository = requireNonNull(snapshotRepository, "No snapshotRepository option provided");
        this.eventBus = requireNonNull(eventBus, "No eventBus provided");
        requireTrue(configuration.persistenceStrategy == PersistenceStrategy.SNAPSHOT,
                    "A SnapshotAggregateRepository requires an aggregate type configured as SNAPSHOT");
    }

    @Override
    public AGGREGATE_TYPE newInstance() {
        return configuration.newAggregateInstance();
    }

    @Override
    public Optional<AGGREGATE_TYPE> getById(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        log.trace("Trying to load {} with id '{}'", aggregateImplementationType().getName(), aggregateId);
        return requireSnapshotRepository().getById(aggregateId);
    }

    @Override
    public List<AGGREGATE_TYPE> getAll() {
        return requireSnapshotRepository().getAll();
    }

    @Override
    public void save(AGGREGATE_TYPE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        var aggregateId       = aggregate.aggregateId();
        var uncommittedEvents = List.copyOf(aggregate.uncommittedEvents());
        requireSnapshotRepository().save(aggregateId, aggregate);
        log.debug("Saved snapshot of {} with id '{}'", aggregateImplementationType().getName(), aggregateId);
        emit(DataChange.saved(aggregateId, aggregate));
        uncommittedEvents.forEach(eventBus::publish);
        aggregate.markChangesAsCommitted();
    }

    @Override
    public void delete(AGGREGATE_TYPE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        var aggregateId = aggregate.aggregateId();
        requireSnapshotRepository().deleteId(aggregateId);
        log.debug("Deleted {} with id '{}'", aggregateImplementationType().getName(), aggregateId);
        emit(DataChange.deleted(aggregateId, aggregate));
    }

    @Override
    public void deleteId(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireSnapshotRepository().deleteId(aggregateId);
        log.debug("Deleted {} with id '{}'", aggregateImplementationType().getName(), aggregateId);
        emit(DataChange.deleted(aggregateId, null));
    }

    @Override
    public Flux<DataChange> changes() {
        return changes.asFlux();
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
     * Completes {@link #changes()} and closes the {@link NotificationEventBus} (if it's {@link AutoCloseable})
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        changes.tryEmitComplete();
        if (eventBus instanceof AutoCloseable) {
            try {
                ((AutoCloseable) eventBus).close();
            } catch (Exception e) {
                throw new AggregateException("Failed to close the event bus", e);
            }
        }
    }

    private void emit(DataChange change) {
        var result = changes.tryEmitNext(change);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("Couldn't announce {}: {}", change, result);
        }
    }

    private SnapshotRepository<ID, AGGREGATE_TYPE> requireSnapshotRepository() {
        requireFalse(closed, "The repository has been closed");
        return snapshotRepository.orElseThrow(() -> new AggregateException(msg("No SnapshotRepository has been registered for aggregate type '{}'",
                                                                                 aggregateType())));
    }
}
