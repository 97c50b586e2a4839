package dk.cloudcreate.domainkit.common.transaction;

/**
 * Delimits a logical batch of persistence operations.<br>
 * Typical usage:
 * <pre>{@code
 * try (var scope = domainContext.beginUnitOfWork()) {
 *     var order = repository.load(orderId);
 *     order.accept();
 *     repository.save(order);
 *     scope.commit();
 * }
 * }</pre>
 * Closing a scope that hasn't been committed rolls it back.
 */
public interface UnitOfWorkScope extends AutoCloseable {
    /**
     * Commit the scope and any underlying transaction - see {@link UnitOfWorkStatus#Committed}
     */
    void commit();

    /**
     * Roll back the scope and any underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback (may be null)
     */
    void rollback(Exception cause);

    /**
     * Get the status of the scope
     */
    UnitOfWorkStatus status();

    /**
     * Rolls back the scope unless it has already been completed (committed or rolled back)
     */
    @Override
    default void close() {
        if (!status().isCompleted()) {
            rollback(null);
        }
    }
}
