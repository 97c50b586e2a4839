package dk.cloudcreate.domainkit.eventstore.postgresql;

import dk.cloudcreate.domainkit.common.transaction.HandleAwareUnitOfWorkFactory;
import dk.cloudcreate.domainkit.eventsourced.aggregates.ConcurrencyException;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.AggregateManifestRepository;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;
import static dk.cloudcreate.domainkit.eventstore.postgresql.PostgresqlUtil.checkIsValidTableOrColumnName;

/**
 * PostgreSQL {@link AggregateManifestRepository} backed by a <code>(aggregate_id TEXT PRIMARY KEY, version BIGINT)</code> table.<br>
 * The compare-and-set is a single conditional statement: an <code>INSERT ... ON CONFLICT DO NOTHING</code> for a new aggregate and
 * an <code>UPDATE ... WHERE version = expectedVersion</code> otherwise. A statement that affects no rows means another writer got there
 * first. Concurrent writers of the same aggregate are serialized by the row lock, so the second writer sees the first writer's version
 */
public class PostgresqlAggregateManifestRepository implements AggregateManifestRepository {
    private static final Logger log                         = LoggerFactory.getLogger(PostgresqlAggregateManifestRepository.class);
    public static final  String DEFAULT_MANIFEST_TABLE_NAME = "aggregate_manifest";

    private final HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
    private final String                          manifestTableName;

    public PostgresqlAggregateManifestRepository(HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
        this(unitOfWorkFactory, DEFAULT_MANIFEST_TABLE_NAME);
    }

    public PostgresqlAggregateManifestRepository(HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory, String manifestTableName) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.manifestTableName = checkIsValidTableOrColumnName(requireNonNull(manifestTableName, "No manifestTableName provided"));
        initializeManifestTable();
    }

    protected void initializeManifestTable() {
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute("CREATE TABLE IF NOT EXISTS " + manifestTableName + " (\n" +
                                                "aggregate_id TEXT NOT NULL,\n" +
                                                "version BIGINT NOT NULL,\n" +
                                                "PRIMARY KEY (aggregate_id)\n" +
                                                ")");
            log.info("Ensured the '{}' manifest table exists", manifestTableName);
        });
    }

    public String getManifestTableName() {
        return manifestTableName;
    }

    @Override
    public void updateManifest(Object aggregateId, long expectedVersion, long newVersion) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireTrue(newVersion > expectedVersion, msg("newVersion {} must be greater than expectedVersion {}", newVersion, expectedVersion));
        var key = String.valueOf(aggregateId);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var handle = unitOfWork.handle();
            int rowsUpdated;
            if (expectedVersion == 0) {
                rowsUpdated = handle.createUpdate("INSERT INTO " + manifestTableName + " (aggregate_id, version) VALUES (:aggregateId, :newVersion)\n" +
                                                          "ON CONFLICT (aggregate_id) DO NOTHING")
                                    .bind("aggregateId", key)
                                    .bind("newVersion", newVersion)
                                    .execute();
            } else {
                rowsUpdated = handle.createUpdate("UPDATE " + manifestTableName + " SET version = :newVersion\n" +
                                                          "WHERE aggregate_id = :aggregateId AND version = :expectedVersion")
                                    .bind("aggregateId", key)
                                    .bind("newVersion", newVersion)
                                    .bind("expectedVersion", expectedVersion)
                                    .execute();
            }
            if (rowsUpdated == 0) {
                var actualVersion = getManifestVersion(handle, key);
                log.debug("Manifest conflict for aggregate '{}': expected version {} but found {}", key, expectedVersion, actualVersion);
                throw new ConcurrencyException(aggregateId, expectedVersion, actualVersion);
            }
            log.trace("Updated manifest for aggregate '{}' from version {} to {}", key, expectedVersion, newVersion);
        });
    }

    @Override
    public long getManifestVersion(Object aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var key = String.valueOf(aggregateId);
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> getManifestVersion(unitOfWork.handle(), key));
    }

    private long getManifestVersion(Handle handle, String key) {
        return handle.createQuery("SELECT version FROM " + manifestTableName + " WHERE aggregate_id = :aggregateId")
                     .bind("aggregateId", key)
                     .mapTo(Long.class)
                     .findOne()
                     .orElse(0L);
    }
}
