package dk.cloudcreate.domainkit.eventsourced.aggregates.command;

import java.util.function.Consumer;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * A command targeting a single aggregate instance
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate implementation type
 */
public interface AggregateCommand<ID, AGGREGATE_TYPE> {
    /**
     * The id of the aggregate the command targets
     */
    ID aggregateId();

    /**
     * Execute the command on the aggregate. The aggregate is a blank instance if it didn't exist
     */
    void executeOn(AGGREGATE_TYPE aggregate);

    static <ID, AGGREGATE_TYPE> AggregateCommand<ID, AGGREGATE_TYPE> of(ID aggregateId, Consumer<AGGREGATE_TYPE> commandHandler) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(commandHandler, "No commandHandler provided");
        return new AggregateCommand<>() {
            @Override
            public ID aggregateId() {
                return aggregateId;
            }

            @Override
            public void executeOn(AGGREGATE_TYPE aggregate) {
                commandHandler.accept(aggregate);
            }

            @Override
            public String toString() {
                return "AggregateCommand{aggregateId=" + aggregateId + '}';
            }
        };
    }
}
