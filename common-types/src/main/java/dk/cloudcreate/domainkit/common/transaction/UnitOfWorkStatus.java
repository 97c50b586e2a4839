package dk.cloudcreate.domainkit.common.transaction;

/**
 * Lifecycle of a {@link UnitOfWork} / {@link UnitOfWorkScope}:
 * <pre>
 * Ready -> Started -> Committed
 *                  -> RolledBack
 *                  -> MarkedForRollbackOnly -> RolledBack
 * </pre>
 * A unit of work in a completed state can't be committed again, but may be started again.
 */
public enum UnitOfWorkStatus {
    /**
     * Created, no transaction yet
     */
    Ready(false),
    /**
     * Transaction open, writes are pending
     */
    Started(false),
    Committed(true),
    RolledBack(true),
    /**
     * A joined participant failed. The owner's <code>commit()</code> turns into a rollback
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    /**
     * @return true for {@link #Committed} and {@link #RolledBack}
     */
    public boolean isCompleted() {
        return isCompleted;
    }
}
