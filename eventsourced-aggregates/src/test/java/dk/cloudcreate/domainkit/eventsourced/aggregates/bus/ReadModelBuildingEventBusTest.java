package dk.cloudcreate.domainkit.eventsourced.aggregates.bus;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.context.DomainContext;
import dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel.ReadModelBuilder;
import dk.cloudcreate.domainkit.eventsourced.aggregates.repository.ReadModelChangedEvent;
import dk.cloudcreate.domainkit.eventsourced.aggregates.repository.DataChange;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.inmemory.InMemoryEventStore;
import dk.cloudcreate.domainkit.eventsourced.aggregates.store.serializer.json.JacksonEventSerializer;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.OrderEvents.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ReadModelBuildingEventBusTest {
    private LocalNotificationEventBus eventBus;
    private DomainContext             domainContext;
    private List<String>              deliveries;

    @BeforeEach
    void setup() {
        var eventStore = new InMemoryEventStore();
        eventBus = new LocalNotificationEventBus("Orders");
        domainContext = new DomainContext(eventStore, eventStore, new JacksonEventSerializer(), eventBus);
        deliveries = new ArrayList<>();
        eventBus.subscribe(event -> deliveries.add("bus:" + event.getClass().getSimpleName()));
    }

    @AfterEach
    void cleanup() {
        eventBus.close();
    }

    @Test
    void aggregate_events_are_handed_to_the_builders_before_the_wrapped_bus() {
        // Given
        domainContext.registerBuilder(Order.ORDERS, (context, bus) -> new RecordingReadModelBuilder("first", deliveries))
                     .registerBuilder(Order.ORDERS, (context, bus) -> new RecordingReadModelBuilder("second", deliveries));
        var readModelBuildingEventBus = new ReadModelBuildingEventBus(domainContext, Order.ORDERS, eventBus);
        var event                     = new OrderAccepted();
        event.version(7);

        // When
        readModelBuildingEventBus.publish(event);

        // Then
        assertThat(deliveries).containsExactly("first:7", "second:7", "bus:OrderAccepted");
    }

    @Test
    void other_domain_events_only_reach_the_wrapped_bus() {
        // Given
        domainContext.registerBuilder(Order.ORDERS, (context, bus) -> new RecordingReadModelBuilder("first", deliveries));
        var readModelBuildingEventBus = new ReadModelBuildingEventBus(domainContext, Order.ORDERS, eventBus);

        // When
        readModelBuildingEventBus.publish(new ReadModelChangedEvent(DataChange.ChangeType.Saved, "summary-1", "summary"));

        // Then
        assertThat(deliveries).containsExactly("bus:ReadModelChangedEvent");
    }

    @Test
    void builders_of_other_aggregate_types_are_not_used() {
        // Given
        domainContext.registerBuilder(Customer.CUSTOMERS, (context, bus) -> new RecordingReadModelBuilder("customers", deliveries));
        var readModelBuildingEventBus = new ReadModelBuildingEventBus(domainContext, Order.ORDERS, eventBus);

        // When
        readModelBuildingEventBus.publish(new OrderAccepted());

        // Then
        assertThat(readModelBuildingEventBus.readModelBuilders()).isEmpty();
        assertThat(deliveries).containsExactly("bus:OrderAccepted");
    }

    @Test
    void a_failing_builder_stops_the_delivery() {
        // Given
        domainContext.registerBuilder(Order.ORDERS, (context, bus) -> new ReadModelBuilder() {
            @Override
            public void handle(AggregateEvent<?> event) {
                throw new IllegalStateException("Projection store unavailable");
            }
        });
        domainContext.registerBuilder(Order.ORDERS, (context, bus) -> new RecordingReadModelBuilder("second", deliveries));
        var readModelBuildingEventBus = new ReadModelBuildingEventBus(domainContext, Order.ORDERS, eventBus);

        // Then
        assertThatThrownBy(() -> readModelBuildingEventBus.publish(new OrderAccepted()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Projection store unavailable");
        assertThat(deliveries).isEmpty();
    }

    @Test
    void closing_closes_the_builders_and_leaves_the_wrapped_bus_open() {
        // Given
        domainContext.registerBuilder(Order.ORDERS, (context, bus) -> new RecordingReadModelBuilder("first", deliveries));
        var readModelBuildingEventBus = new ReadModelBuildingEventBus(domainContext, Order.ORDERS, eventBus);
        var received                  = new ArrayList<DomainEvent>();
        readModelBuildingEventBus.subscribe(received::add);

        // When
        readModelBuildingEventBus.close();
        readModelBuildingEventBus.close();

        // Then
        assertThat(readModelBuildingEventBus.readModelBuilders())
                .allSatisfy(builder -> assertThat(((RecordingReadModelBuilder) builder).closed).isTrue());
        var event = new OrderAccepted();
        eventBus.publish(event);
        assertThat(received).containsExactly(event);
    }
}
