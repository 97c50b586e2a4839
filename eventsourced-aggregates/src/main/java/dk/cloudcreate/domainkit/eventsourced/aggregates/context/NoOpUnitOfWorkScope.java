package dk.cloudcreate.domainkit.eventsourced.aggregates.context;

import dk.cloudcreate.domainkit.common.transaction.*;
import org.slf4j.*;

/**
 * {@link UnitOfWorkScope} that only tracks its status. Used by a {@link DomainContext} whose stores don't support transactions
 */
public final class NoOpUnitOfWorkScope implements UnitOfWorkScope {
    private static final Logger log = LoggerFactory.getLogger(NoOpUnitOfWorkScope.class);

    private UnitOfWorkStatus status = UnitOfWorkStatus.Started;

    @Override
    public void commit() {
        log.trace("Commit");
        status = UnitOfWorkStatus.Committed;
    }

    @Override
    public void rollback(Exception cause) {
        log.trace("Rollback");
        status = UnitOfWorkStatus.RolledBack;
    }

    @Override
    public UnitOfWorkStatus status() {
        return status;
    }
}
