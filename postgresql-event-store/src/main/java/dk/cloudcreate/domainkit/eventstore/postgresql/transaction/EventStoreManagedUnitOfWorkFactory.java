package dk.cloudcreate.domainkit.eventstore.postgresql.transaction;

import dk.cloudcreate.domainkit.common.transaction.*;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

/**
 * {@link UnitOfWorkFactory} variant where the event store itself manages the {@link UnitOfWork} and the underlying
 * database transaction.<br>
 * The {@link dk.cloudcreate.domainkit.eventstore.postgresql.PostgresqlEventStoreRepository} and the
 * {@link dk.cloudcreate.domainkit.eventstore.postgresql.PostgresqlAggregateManifestRepository} must share the same factory,
 * so the manifest update and the appended events of a save are committed or rolled back together
 */
public class EventStoreManagedUnitOfWorkFactory extends GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> {
    private static final Logger log = LoggerFactory.getLogger(EventStoreManagedUnitOfWorkFactory.class);

    public EventStoreManagedUnitOfWorkFactory(Jdbi jdbi) {
        super(jdbi);
    }

    @Override
    protected GenericHandleAwareUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<GenericHandleAwareUnitOfWork> unitOfWorkFactory) {
        return new EventStoreManagedUnitOfWork(unitOfWorkFactory);
    }

    private static class EventStoreManagedUnitOfWork extends GenericHandleAwareUnitOfWork {
        private EventStoreManagedUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            super(unitOfWorkFactory);
        }

        @Override
        protected void afterCommitting() {
            log.trace("Committed the event store UnitOfWork");
        }

        @Override
        protected void afterRollback(Exception cause) {
            if (cause != null) {
                log.debug("Rolled back the event store UnitOfWork due to {}: {}", cause.getClass().getSimpleName(), cause.getMessage());
            } else {
                log.debug("Rolled back the event store UnitOfWork");
            }
        }
    }
}
