package dk.cloudcreate.domainkit.eventsourced.aggregates.context;

import dk.cloudcreate.domainkit.eventsourced.aggregates.AggregateException;

/**
 * Thrown when the {@link DomainContext} is asked for an aggregate type that hasn't been registered
 */
public class UnknownAggregateTypeException extends AggregateException {
    public UnknownAggregateTypeException(String message) {
        super(message);
    }
}
