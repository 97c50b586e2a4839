package dk.cloudcreate.domainkit.common.transaction;

import org.jdbi.v3.core.Handle;

/**
 * {@link UnitOfWork} backed by a single Jdbi {@link Handle} with an open database transaction.<br>
 * Every repository that joins the same unit of work issues its statements through this {@link Handle}, so event rows and
 * manifest rows written while it's active are committed or rolled back together.
 */
public interface HandleAwareUnitOfWork extends UnitOfWork {
    /**
     * The {@link Handle} that owns this unit of work's transaction
     *
     * @return the active {@link Handle}
     * @throws UnitOfWorkException if the unit of work hasn't been started, or has already been committed or rolled back
     */
    Handle handle();
}
