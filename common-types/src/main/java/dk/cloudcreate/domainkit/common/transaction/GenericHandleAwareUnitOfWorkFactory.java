package dk.cloudcreate.domainkit.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;
import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

/**
 * Generic {@link HandleAwareUnitOfWorkFactory} that binds the active {@link HandleAwareUnitOfWork} to the calling thread.<br>
 * Each {@link UnitOfWork} opens its own {@link Handle} and database transaction when started, and closes the {@link Handle}
 * once it's committed or rolled back.
 *
 * @param <UOW> the concrete {@link HandleAwareUnitOfWork} type
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends GenericHandleAwareUnitOfWorkFactory.GenericHandleAwareUnitOfWork> implements HandleAwareUnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi             jdbi;
    private final ThreadLocal<UOW> unitOfWorks = new ThreadLocal<>();

    public GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    /**
     * The {@link Jdbi} instance used to open {@link Handle}'s
     */
    public Jdbi getJdbi() {
        return jdbi;
    }

    /**
     * Create a new (not yet started) {@link UnitOfWork} instance
     */
    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            log.debug("Creating new UnitOfWork");
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    private void removeUnitOfWork() {
        log.debug("Removing UnitOfWork from the current thread");
        unitOfWorks.remove();
    }

    /**
     * {@link HandleAwareUnitOfWork} that manages its own {@link Handle} and database transaction
     */
    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private final Logger                                   log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWork.class);
        private final GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
        private       Handle                                   handle;
        private       UnitOfWorkStatus                         status;
        private       Exception                                causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.debug("Starting UnitOfWork with initial status {}", status);
                log.trace("Opening JDBI handle");
                handle = unitOfWorkFactory.jdbi.open();
                handle.begin();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
            } else {
                close(handle);
                unitOfWorkFactory.removeUnitOfWork();
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork as it has status {} and not the expected status {}, {} or {}",
                                                  status,
                                                  UnitOfWorkStatus.Ready,
                                                  UnitOfWorkStatus.Committed,
                                                  UnitOfWorkStatus.RolledBack));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.Started) {
                beforeCommitting();
                log.debug("Committing UnitOfWork");
                try {
                    handle.commit();
                } catch (RuntimeException e) {
                    status = UnitOfWorkStatus.RolledBack;
                    causeOfRollback = e;
                    throw new UnitOfWorkException("Failed to commit UnitOfWork", e);
                } finally {
                    close(handle);
                    unitOfWorkFactory.removeUnitOfWork();
                }
                status = UnitOfWorkStatus.Committed;
                afterCommitting();
            } else if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback(causeOfRollback);
            } else {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
        }

        @Override
        public void rollback(Exception cause) {
            if (status == UnitOfWorkStatus.Started || status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                causeOfRollback = cause != null ? cause : causeOfRollback;
                var description = msg("Rolling back UnitOfWork with status {}{}", status, causeOfRollback != null ? " due to " + causeOfRollback.getMessage() : "");
                if (log.isTraceEnabled()) {
                    log.trace(description, causeOfRollback);
                } else {
                    log.debug(description);
                }
                try {
                    handle.rollback();
                } finally {
                    close(handle);
                    unitOfWorkFactory.removeUnitOfWork();
                }
                status = UnitOfWorkStatus.RolledBack;
                afterRollback(causeOfRollback);
            } else if (status != UnitOfWorkStatus.RolledBack) {
                throw new UnitOfWorkException(msg("Cannot rollback a UnitOfWork with status {}", status));
            }
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status == UnitOfWorkStatus.Started) {
                log.debug("Marking UnitOfWork for Rollback Only{}", cause != null ? " due to " + cause.getMessage() : "");
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            }
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException("No active transaction");
            }
            return handle;
        }

        /**
         * Called right before the underlying transaction is committed
         */
        protected void beforeCommitting() {
        }

        /**
         * Called after the underlying transaction has been committed
         */
        protected void afterCommitting() {
        }

        /**
         * Called after the underlying transaction has been rolled back
         *
         * @param cause the cause of the rollback (may be null)
         */
        protected void afterRollback(Exception cause) {
        }

        private void close(Handle handle) {
            if (handle == null) {
                return;
            }
            log.trace("Closing JDBI handle");
            try {
                handle.close();
            } catch (Exception e) {
                log.error("Failed to close JDBI handle", e);
            }
        }
    }
}
