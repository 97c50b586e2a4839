package dk.cloudcreate.domainkit.eventstore.postgresql;

import dk.cloudcreate.domainkit.common.transaction.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.NotificationEventBus;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.*;
import dk.cloudcreate.domainkit.eventstore.postgresql.transaction.EventStoreManagedUnitOfWorkFactory;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * {@link DomainContext} backed by the {@link PostgresqlEventStoreRepository} and {@link PostgresqlAggregateManifestRepository}.<br>
 * {@link #beginUnitOfWork()} starts a database transaction, which every repository opened by this context joins until the scope
 * is committed or rolled back. If a {@link UnitOfWork} is already active on the calling thread, the scope joins it instead: committing
 * the joined scope leaves the commit to the owner of the {@link UnitOfWork}, rolling it back marks the {@link UnitOfWork} as rollback only.
 * <pre>{@code
 * var domainContext = new PostgresqlDomainContext(jdbi, new JacksonEventSerializer(), new LocalNotificationEventBus("Domain"));
 * domainContext.registerAggregateType(AggregateTypeConfiguration.eventSourced(ACCOUNTS, Account.class));
 * domainContext.newCommandExecutor(Account.class).execute(accountId, account -> account.deposit(amount));
 * }</pre>
 */
public class PostgresqlDomainContext extends DomainContext {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlDomainContext.class);

    private final HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;

    /**
     * Create a context using the default table names
     */
    public PostgresqlDomainContext(Jdbi jdbi, EventSerializer eventSerializer, NotificationEventBus eventBus) {
        this(new EventStoreManagedUnitOfWorkFactory(jdbi), eventSerializer, eventBus);
    }

    public PostgresqlDomainContext(HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory, EventSerializer eventSerializer, NotificationEventBus eventBus) {
        this(unitOfWorkFactory,
             new PostgresqlEventStoreRepository(unitOfWorkFactory),
             new PostgresqlAggregateManifestRepository(unitOfWorkFactory),
             eventSerializer,
             eventBus);
    }

    /**
     * @param unitOfWorkFactory the unit of work factory that <code>eventStore</code> and <code>manifest</code> were created with
     */
    public PostgresqlDomainContext(HandleAwareUnitOfWorkFactory<?> unitOfWorkFactory,
                                   EventStoreRepository eventStore,
                                   AggregateManifestRepository manifest,
                                   EventSerializer eventSerializer,
                                   NotificationEventBus eventBus) {
        super(eventStore, manifest, eventSerializer, eventBus);
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
    }

    public HandleAwareUnitOfWorkFactory<?> getUnitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    @Override
    public UnitOfWorkScope beginUnitOfWork() {
        var existingUnitOfWork = unitOfWorkFactory.getCurrentUnitOfWork();
        if (existingUnitOfWork.isPresent()) {
            log.debug("Joining the UnitOfWork already active on this thread");
            return new JoinedUnitOfWorkScope(existingUnitOfWork.get());
        }
        return unitOfWorkFactory.getOrCreateNewUnitOfWork();
    }

    private static class JoinedUnitOfWorkScope implements UnitOfWorkScope {
        private final UnitOfWork       unitOfWork;
        private       UnitOfWorkStatus status = UnitOfWorkStatus.Started;

        private JoinedUnitOfWorkScope(UnitOfWork unitOfWork) {
            this.unitOfWork = unitOfWork;
        }

        @Override
        public void commit() {
            log.trace("Leaving the commit to the owner of the joined UnitOfWork");
            status = UnitOfWorkStatus.Committed;
        }

        @Override
        public void rollback(Exception cause) {
            unitOfWork.markAsRollbackOnly(cause);
            status = UnitOfWorkStatus.RolledBack;
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }
    }
}
