package dk.cloudcreate.domainkit.eventsourced.aggregates;

import dk.cloudcreate.domainkit.common.types.CharSequenceType;

/**
 * Stable name of a type of aggregate, used as the key for all registrations in the
 * {@link dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext}.<br>
 * <b>Note: The aggregate type is only a name and shouldn't be confused with the Fully Qualified Class Name of an Aggregate implementation class.</b><br>
 * The {@link AggregateType} is typically the plural name of the type of aggregate, e.g. "Orders" or "Accounts"
 */
public class AggregateType extends CharSequenceType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
