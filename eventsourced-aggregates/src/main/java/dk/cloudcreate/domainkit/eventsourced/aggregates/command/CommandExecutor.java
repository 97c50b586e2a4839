package dk.cloudcreate.domainkit.eventsourced.aggregates.command;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;

import java.util.function.Consumer;

/**
 * Executes commands against aggregates of one type: load (or create), execute, save and commit - in one unit of work per command
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public interface CommandExecutor<ID, AGGREGATE_TYPE extends AggregateRoot<ID>> {
    /**
     * @param command the command
     * @throws ConcurrencyException if the aggregate was changed concurrently (and no retries remain)
     */
    void execute(AggregateCommand<ID, AGGREGATE_TYPE> command);

    /**
     * @param aggregateId    the id of the aggregate
     * @param commandHandler the logic to execute on the aggregate
     * @throws ConcurrencyException if the aggregate was changed concurrently (and no retries remain)
     */
    default void execute(ID aggregateId, Consumer<AGGREGATE_TYPE> commandHandler) {
        execute(AggregateCommand.of(aggregateId, commandHandler));
    }
}
