package dk.cloudcreate.domainkit.eventsourced.aggregates.repository;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.bus.LocalNotificationEventBus;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.inmemory.InMemoryEventStore;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer.json.JacksonEventSerializer;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.CustomerEvents.CustomerRenamed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class SnapshotAggregateRepositoryTest {
    private LocalNotificationEventBus                        eventBus;
    private DomainContext                                    domainContext;
    private InMemorySnapshotRepository<CustomerId, Customer> snapshots;
    private List<DomainEvent>                                busEvents;

    @BeforeEach
    void setup() {
        var eventStore = new InMemoryEventStore();
        eventBus = new LocalNotificationEventBus("CustomerEvents");
        domainContext = new DomainContext(eventStore, eventStore, new JacksonEventSerializer(), eventBus);
        domainContext.registerAggregateType(AggregateTypeConfiguration.snapshot(Customer.CUSTOMERS, Customer.class));
        snapshots = new InMemorySnapshotRepository<>();
        busEvents = new CopyOnWriteArrayList<>();
        eventBus.subscribe(busEvents::add);
    }

    @AfterEach
    void cleanup() {
        eventBus.close();
    }

    @Test
    void saving_a_customer_stores_the_snapshot_and_announces_the_change_before_the_events() {
        // Given
        domainContext.registerSnapshot(Customer.CUSTOMERS, context -> snapshots);
        var customerId = CustomerId.random();
        var customer   = new Customer();
        customer.rename(customerId, "Ada");

        // When
        try (AggregateRepository<CustomerId, Customer> customers = domainContext.getAggregateRepository(Customer.class)) {
            customers.save(customer);
            assertThat(customers.load(customerId).name()).isEqualTo("Ada");
            assertThat(customers.getAll()).containsExactly(customer);
        }

        // Then
        assertThat(customer.uncommittedEvents()).isEmpty();
        assertThat(busEvents).hasSize(2);
        assertThat(busEvents.get(0)).isEqualTo(new ReadModelChangedEvent(DataChange.ChangeType.Saved, customerId, customer));
        assertThat(busEvents.get(1)).isInstanceOf(CustomerRenamed.class);
    }

    @Test
    void deleting_a_customer_announces_the_deletion() {
        // Given
        domainContext.registerSnapshot(Customer.CUSTOMERS, context -> snapshots);
        var customerId = CustomerId.random();
        var customer   = new Customer();
        customer.rename(customerId, "Grace");
        snapshots.save(customerId, customer);
        var otherCustomerId = CustomerId.random();

        // When
        try (AggregateRepository<CustomerId, Customer> customers = domainContext.getAggregateRepository(Customer.class)) {
            customers.delete(customer);
            customers.deleteId(otherCustomerId);
            assertThat(customers.getById(customerId)).isEmpty();
        }

        // Then
        assertThat(busEvents).containsExactly(new ReadModelChangedEvent(DataChange.ChangeType.Deleted, customerId, customer),
                                              new ReadModelChangedEvent(DataChange.ChangeType.Deleted, otherCustomerId, null));
    }

    @Test
    void a_repository_without_a_registered_snapshot_repository_fails_when_used() {
        // Given
        try (AggregateRepository<CustomerId, Customer> customers = domainContext.getAggregateRepository(Customer.class)) {
            // When
            var thrown = catchThrowable(() -> customers.getById(CustomerId.random()));

            // Then
            assertThat(thrown).isInstanceOf(AggregateException.class)
                              .hasMessageContaining("No SnapshotRepository has been registered")
                              .hasMessageContaining("Customers");
            assertThat(customers.newInstance()).isInstanceOf(Customer.class);
        }
    }

    @Test
    void closing_the_repository_completes_its_changes() {
        // Given
        domainContext.registerSnapshot(Customer.CUSTOMERS, context -> snapshots);
        var repository = (SnapshotAggregateRepository<CustomerId, Customer>) domainContext.<CustomerId, Customer>getAggregateRepository(Customer.class);
        var completed  = new AtomicBoolean();
        repository.changes().subscribe(change -> {
        }, error -> {
        }, () -> completed.set(true));

        // When
        repository.close();
        repository.close();

        // Then
        assertThat(completed).isTrue();
        var customer = new Customer();
        customer.rename(CustomerId.random(), "Linus");
        assertThatThrownBy(() -> repository.save(customer)).isInstanceOf(IllegalArgumentException.class);
        assertThat(busEvents).isEmpty();
    }
}
