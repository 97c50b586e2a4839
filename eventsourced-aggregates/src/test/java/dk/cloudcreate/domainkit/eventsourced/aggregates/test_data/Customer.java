package dk.cloudcreate.domainkit.eventsourced.aggregates.test_data;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.CustomerEvents.CustomerRenamed;

import java.util.*;

/**
 * Example aggregate whose current state is stored as a snapshot
 */
public class Customer implements AggregateRoot<CustomerId> {
    public static final AggregateType CUSTOMERS = AggregateType.of("Customers");

    private CustomerId                       customerId;
    private String                           name;
    private long                             version;
    private List<AggregateEvent<CustomerId>> uncommittedEvents = new ArrayList<>();

    public Customer() {
    }

    public void rename(CustomerId customerId, String newName) {
        this.customerId = customerId;
        this.name = newName;
        version++;
        var event = new CustomerRenamed(customerId, newName);
        event.version(version);
        event.eventId(UUID.randomUUID());
        uncommittedEvents.add(event);
    }

    public String name() {
        return name;
    }

    @Override
    public CustomerId aggregateId() {
        return customerId;
    }

    @Override
    public long version() {
        return version;
    }

    @Override
    public List<AggregateEvent<CustomerId>> uncommittedEvents() {
        return uncommittedEvents;
    }

    @Override
    public void markChangesAsCommitted() {
        uncommittedEvents = new ArrayList<>();
    }
}
