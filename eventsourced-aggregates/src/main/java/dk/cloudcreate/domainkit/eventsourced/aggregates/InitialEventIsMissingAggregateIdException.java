package dk.cloudcreate.domainkit.eventsourced.aggregates;

/**
 * Thrown when the first event applied to an aggregate doesn't carry the aggregate id
 */
public class InitialEventIsMissingAggregateIdException extends AggregateException {
    public InitialEventIsMissingAggregateIdException(String message) {
        super(message);
    }
}
