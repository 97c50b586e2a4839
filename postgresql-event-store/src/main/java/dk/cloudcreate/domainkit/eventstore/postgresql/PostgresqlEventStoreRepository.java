package dk.cloudcreate.domainkit.eventstore.postgresql;

import dk.cloudcreate.domainkit.common.transaction.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.*;
import org.jdbi.v3.core.statement.StatementException;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;
import static dk.cloudcreate.domainkit.eventstore.postgresql.PostgresqlUtil.checkIsValidTableOrColumnName;

/**
 * PostgreSQL {@link EventStoreRepository} that keeps the events of all aggregates in one table:
 * <pre>
 * aggregate_id TEXT, version BIGINT, event_id TEXT, event_type TEXT, event JSONB, added_ts TIMESTAMP WITH TIME ZONE
 * PRIMARY KEY (aggregate_id, version)
 * </pre>
 * Every operation joins the {@link UnitOfWork} active on the calling thread, or runs in a new one.
 * {@link #executeAtomically(Runnable)} therefore covers every write made through repositories sharing the same
 * {@link HandleAwareUnitOfWorkFactory}, such as the {@link PostgresqlAggregateManifestRepository}
 */
public class PostgresqlEventStoreRepository implements EventStoreRepository {
    private static final Logger log                       = LoggerFactory.getLogger(PostgresqlEventStoreRepository.class);
    public static final  String DEFAULT_EVENTS_TABLE_NAME = "aggregate_events";

    private final HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
    private final String                          eventsTableName;
    private final Clock                           clock;
    private final StoredEventRowMapper            storedEventRowMapper = new StoredEventRowMapper();

    public PostgresqlEventStoreRepository(HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
        this(unitOfWorkFactory, DEFAULT_EVENTS_TABLE_NAME, Clock.systemUTC());
    }

    /**
     * @param unitOfWorkFactory the unit of work factory shared with the {@link PostgresqlAggregateManifestRepository}
     * @param eventsTableName   the name of the events table (created if it doesn't exist)
     * @param clock             the clock used to timestamp new events
     */
    public PostgresqlEventStoreRepository(HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory, String eventsTableName, Clock clock) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.eventsTableName = checkIsValidTableOrColumnName(requireNonNull(eventsTableName, "No eventsTableName provided"));
        this.clock = requireNonNull(clock, "No clock provided");
        initializeEventsTable();
    }

    protected void initializeEventsTable() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute("CREATE TABLE IF NOT EXISTS " + eventsTableName + " (\n" +
                                                "aggregate_id TEXT NOT NULL,\n" +
                                                "version BIGINT NOT NULL,\n" +
                                                "event_id TEXT NOT NULL,\n" +
                                                "event_type TEXT NOT NULL,\n" +
                                                "event JSONB NOT NULL,\n" +
                                                "added_ts TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                "PRIMARY KEY (aggregate_id, version)\n" +
                                                ")");
            log.info("Ensured the '{}' events table exists", eventsTableName);
        });
    }

    public String getEventsTableName() {
        return eventsTableName;
    }

    @Override
    public List<StoredEvent> getAllAggregateEvents(Object aggregateId) {
        var key = toKey(aggregateId);
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                         .createQuery("SELECT * FROM " + eventsTableName + " WHERE aggregate_id = :aggregateId ORDER BY version")
                                                                         .bind("aggregateId", key)
                                                                         .map(storedEventRowMapper)
                                                                         .list());
    }

    @Override
    public Optional<StoredEvent> getLastAggregateEvent(Object aggregateId) {
        var key = toKey(aggregateId);
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                         .createQuery("SELECT * FROM " + eventsTableName + " WHERE aggregate_id = :aggregateId ORDER BY version DESC LIMIT 1")
                                                                         .bind("aggregateId", key)
                                                                         .map(storedEventRowMapper)
                                                                         .findOne());
    }

    @Override
    public void save(StoredEvent storedEvent) {
        requireNonNull(storedEvent, "No storedEvent provided");
        requireNonNull(storedEvent.aggregateId(), "The storedEvent has no aggregateId");
        requireNonNull(storedEvent.eventId(), "The storedEvent has no eventId");
        requireNonNull(storedEvent.eventType(), "The storedEvent has no eventType");
        requireNonNull(storedEvent.event(), "The storedEvent has no event");
        requireTrue(storedEvent.version() > 0, msg("The storedEvent for aggregate '{}' has version {}, versions must be positive", storedEvent.aggregateId(), storedEvent.version()));
        if (storedEvent.timestamp() == null) {
            storedEvent.timestamp(OffsetDateTime.now(clock));
        }
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            try {
                unitOfWork.handle()
                          .createUpdate("INSERT INTO " + eventsTableName + " (aggregate_id, version, event_id, event_type, event, added_ts)\n" +
                                                "VALUES (:aggregateId, :version, :eventId, :eventType, CAST(:event AS JSONB), :addedTs)")
                          .bind("aggregateId", storedEvent.aggregateId())
                          .bind("version", storedEvent.version())
                          .bind("eventId", storedEvent.eventId().toString())
                          .bind("eventType", storedEvent.eventType())
                          .bind("event", storedEvent.event())
                          .bind("addedTs", storedEvent.timestamp())
                          .execute();
            } catch (StatementException e) {
                throw new EventStoreException(msg("Failed to store the event with version {} for aggregate '{}' in '{}'",
                                                  storedEvent.version(),
                                                  storedEvent.aggregateId(),
                                                  eventsTableName), e);
            }
            log.trace("Stored event with version {} for aggregate '{}'", storedEvent.version(), storedEvent.aggregateId());
        });
    }

    @Override
    public void executeAtomically(Runnable work) {
        requireNonNull(work, "No work provided");
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> work.run());
    }

    /**
     * The {@link HandleAwareUnitOfWorkFactory} and its database connections are shared, so there's nothing to release
     */
    @Override
    public void close() {
        log.trace("close() called - no resources to release");
    }

    private static String toKey(Object aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return String.valueOf(aggregateId);
    }
}
