package dk.cloudcreate.domainkit.eventsourced.aggregates.test_data;

import dk.cloudcreate.domainkit.eventsourced.aggregates.AggregateEvent;

public final class CustomerEvents {
    public static class CustomerRenamed extends AggregateEvent<CustomerId> {
        public final String newName;

        public CustomerRenamed(CustomerId customerId, String newName) {
            super(customerId);
            this.newName = newName;
        }
    }
}
