package dk.cloudcreate.domainkit.eventsourced.aggregates.command;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext;
import org.slf4j.*;

import static dk.cloudcreate.domainkit.common.FailFast.*;

/**
 * {@link CommandExecutor} that, per attempt, begins a unit of work using {@link DomainContext#beginUnitOfWork()}, opens a repository
 * on the context's default bus, loads the aggregate (or creates a blank one), executes the command, saves the aggregate and
 * commits the unit of work.<br>
 * By default a {@link ConcurrencyException} is propagated to the caller. Use {@link #withConcurrencyRetries(int)} to retry the command
 * on a freshly loaded aggregate instead.
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public class DomainCommandExecutor<ID, AGGREGATE_TYPE extends AggregateRoot<ID>> implements CommandExecutor<ID, AGGREGATE_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(DomainCommandExecutor.class);

    private final DomainContext         context;
    private final Class<AGGREGATE_TYPE> aggregateImplementationType;
    private final int                   maxConcurrencyRetries;

    public DomainCommandExecutor(DomainContext context, Class<AGGREGATE_TYPE> aggregateImplementationType) {
        this(context, aggregateImplementationType, 0);
    }

    public DomainCommandExecutor(DomainContext context, Class<AGGREGATE_TYPE> aggregateImplementationType, int maxConcurrencyRetries) {
        this.context = requireNonNull(context, "No context provided");
        this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "No aggregateImplementationType provided");
        requireTrue(maxConcurrencyRetries >= 0, "maxConcurrencyRetries must be >= 0");
        this.maxConcurrencyRetries = maxConcurrencyRetries;
    }

    /**
     * Create a copy of this executor that retries a command up to <code>maxConcurrencyRetries</code> times when it fails with a
     * {@link ConcurrencyException}
     */
    public DomainCommandExecutor<ID, AGGREGATE_TYPE> withConcurrencyRetries(int maxConcurrencyRetries) {
        return new DomainCommandExecutor<>(context, aggregateImplementationType, maxConcurrencyRetries);
    }

    @Override
    public void execute(AggregateCommand<ID, AGGREGATE_TYPE> command) {
        requireNonNull(command, "No command provided");
        var attempt = 0;
        while (true) {
            attempt++;
            try {
                executeOnce(command);
                return;
            } catch (ConcurrencyException e) {
                if (attempt > maxConcurrencyRetries) {
                    throw e;
                }
                log.debug("Attempt {} of {} for {} failed with a concurrency conflict - retrying", attempt, maxConcurrencyRetries + 1, command);
            }
        }
    }

    private void executeOnce(AggregateCommand<ID, AGGREGATE_TYPE> command) {
        try (var scope = context.beginUnitOfWork();
             var repository = context.getAggregateRepository(aggregateImplementationType)) {
            var aggregate = repository.getById(command.aggregateId())
                                      .orElseGet(repository::newInstance);
            log.trace("Executing {} on {} with version {}", command, aggregateImplementationType.getSimpleName(), aggregate.version());
            command.executeOn(aggregate);
            repository.save(aggregate);
            scope.commit();
        }
    }
}
