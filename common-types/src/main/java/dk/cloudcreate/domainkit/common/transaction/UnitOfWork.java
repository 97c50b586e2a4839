package dk.cloudcreate.domainkit.common.transaction;

/**
 * A {@link UnitOfWorkScope} with an explicit lifecycle, created and tracked by a {@link UnitOfWorkFactory}
 */
public interface UnitOfWork extends UnitOfWorkScope {
    /**
     * Start the {@link UnitOfWork} and any underlying transaction
     */
    void start();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    /**
     * Mark the {@link UnitOfWork} so that it will be rolled back instead of committed
     *
     * @param cause the reason (may be null)
     */
    void markAsRollbackOnly(Exception cause);

    /**
     * Roll back the {@link UnitOfWork} using any cause registered through {@link #markAsRollbackOnly(Exception)}
     */
    default void rollback() {
        rollback(getCauseOfRollback());
    }
}
