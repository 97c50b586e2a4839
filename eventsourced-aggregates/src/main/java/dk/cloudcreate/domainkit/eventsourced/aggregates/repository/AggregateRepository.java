package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;

import java.util.*;

/**
 * Loads and persists the aggregates of a single aggregate type.<br>
 * Repositories are short lived and not thread safe: open one (see
 * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext#getAggregateRepository(Class)}) per unit of work
 * and close it afterwards.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public interface AggregateRepository<ID, AGGREGATE_TYPE extends AggregateRoot<ID>> extends AutoCloseable {
    /**
     * Create a new blank aggregate instance
     */
    AGGREGATE_TYPE newInstance();

    /**
     * Try to load the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return the aggregate or {@link Optional#empty()} if it doesn't exist
     */
    Optional<AGGREGATE_TYPE> getById(ID aggregateId);

    /**
     * Load the aggregate with the given id
     *
     * @param aggregateId the aggregate id
     * @return the aggregate
     * @throws AggregateNotFoundException if the aggregate doesn't exist
     */
    default AGGREGATE_TYPE load(ID aggregateId) {
        return getById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateImplementationType(), aggregateType()));
    }

    /**
     * Get all aggregates of this type
     *
     * @throws UnsupportedOperationException if the repository can't enumerate its aggregates
     */
    List<AGGREGATE_TYPE> getAll();

    /**
     * Persist the changes made to the aggregate and publish them
     *
     * @param aggregate the aggregate
     * @throws ConcurrencyException if the aggregate was changed by someone else after it was loaded
     */
    void save(AGGREGATE_TYPE aggregate);

    /**
     * @throws UnsupportedOperationException if the repository doesn't support deletion
     */
    void delete(AGGREGATE_TYPE aggregate);

    /**
     * @throws UnsupportedOperationException if the repository doesn't support deletion
     */
    void deleteId(ID aggregateId);

    AggregateType aggregateType();

    Class<AGGREGATE_TYPE> aggregateImplementationType();

    /**
     * Release the resources held by this repository. Calling it more than once has no effect
     */
    @Override
    void close();
}
