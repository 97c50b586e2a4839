package dk.cloudcreate.domainkit.eventsourced.aggregates;

import static dk.cloudcreate.domainkit.common.MessageFormatter.msg;

public class AggregateNotFoundException extends AggregateException {
    public final Object        aggregateId;
    public final Class<?>      aggregateImplementationType;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateImplementationType, AggregateType aggregateType) {
        super(msg("Couldn't find a '{}' aggregate with id '{}' belonging to the aggregate type '{}'",
                  aggregateImplementationType.getName(),
                  aggregateId,
                  aggregateType));
        this.aggregateId = aggregateId;
        this.aggregateImplementationType = aggregateImplementationType;
        this.aggregateType = aggregateType;
    }
}
