package dk.cloudcreate.domainkit.common.transaction;

/**
 * {@link UnitOfWorkFactory} for Jdbi backed repositories.<br>
 * Repositories receive the factory (not a {@link org.jdbi.v3.core.Jdbi} instance) and reach the database through
 * {@link #withUnitOfWork} / {@link #usingUnitOfWork}, which join the caller's {@link HandleAwareUnitOfWork} when one is active
 *
 * @param <UOW> the concrete {@link HandleAwareUnitOfWork} type
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
}
