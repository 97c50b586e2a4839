package dk.cloudcreate.domainkit.eventsourced.aggregates;

import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.OrderEvents.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class EventSourcedAggregateRootTest {

    @Test
    void verify_that_an_initial_event_with_null_aggregateid_causes_failure() {
        assertThatThrownBy(() -> new Order(null, CustomerId.random(), 123))
                .isExactlyInstanceOf(InitialEventIsMissingAggregateIdException.class);
    }

    @Test
    void verify_the_aggregates_id_is_the_same_as_the_initial_events_aggregateid() {
        // Given
        var orderId            = OrderId.random();
        var orderingCustomerId = CustomerId.random();
        var orderNumber        = 123;

        // When
        var order = new Order(orderId,
                              orderingCustomerId,
                              orderNumber);

        // Then
        assertThat(order.uncommittedEvents().size()).isEqualTo(1);
        assertThat(order.uncommittedEvents().get(0)).isInstanceOf(OrderAdded.class);

        var orderAddedEvent = (OrderAdded) order.uncommittedEvents().get(0);
        assertThat((CharSequence) orderAddedEvent.aggregateId()).isEqualTo(orderId);
        assertThat((CharSequence) orderAddedEvent.getOrderingCustomerId()).isEqualTo(orderingCustomerId);
        assertThat(orderAddedEvent.getOrderNumber()).isEqualTo(orderNumber);
        assertThat(orderAddedEvent.version()).isEqualTo(1);
        assertThat(orderAddedEvent.eventId()).isNotNull();

        assertThat((CharSequence) order.aggregateId()).isEqualTo(orderId);
        assertThat(order.version()).isEqualTo(1);
    }

    @Test
    void verify_consecutive_events_get_the_aggregate_id_and_the_next_version() {
        // Given
        var orderId   = OrderId.random();
        var productId = ProductId.random();
        var order     = new Order(orderId, CustomerId.random(), 123);

        // When
        order.addProduct(productId, 2);
        order.adjustProductQuantity(productId, 5);
        order.accept();

        // Then
        assertThat(order.uncommittedEvents()).extracting(AggregateEvent::version).containsExactly(1L, 2L, 3L, 4L);
        assertThat(order.uncommittedEvents()).allSatisfy(event -> assertThat((CharSequence) event.aggregateId()).isEqualTo(orderId));
        assertThat(order.uncommittedEvents()).extracting(AggregateEvent::eventId).doesNotHaveDuplicates();
        assertThat(order.productAndQuantity().get(productId)).isEqualTo(5);
        assertThat(order.isAccepted()).isTrue();
    }

    @Test
    void verify_an_event_with_a_different_aggregate_id_is_rejected() {
        // Given
        var order = new Order(OrderId.random(), CustomerId.random(), 123);

        // When
        var otherOrdersEvent = new OrderAdded(OrderId.random(), CustomerId.random(), 456);

        // Then
        assertThatThrownBy(() -> order.apply(otherOrdersEvent))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_markChangesAsCommitted_resets_uncommittedEvents() {
        // Given
        var orderId   = OrderId.random();
        var aggregate = new Order(orderId, CustomerId.random(), 123);
        assertThat(aggregate.uncommittedEvents().size()).isEqualTo(1);

        // When
        aggregate.markChangesAsCommitted();

        // Then
        assertThat(aggregate.uncommittedEvents()).isEmpty();
        assertThat(aggregate.version()).isEqualTo(1);
    }

    @Test
    void test_rehydrating_aggregate() {
        // Given
        var orderId   = OrderId.random();
        var productId = ProductId.random();

        var aggregate = new Order(orderId, CustomerId.random(), 123);
        aggregate.addProduct(productId, 10);
        assertThat(aggregate.version()).isEqualTo(2);

        // When
        var rehydratedAggregate = AggregateInstanceFactory.objenesisFactory()
                                                          .create(Order.class)
                                                          .rehydrate(aggregate.uncommittedEvents());

        // Then
        assertThat((CharSequence) rehydratedAggregate.aggregateId()).isEqualTo(orderId);
        assertThat(rehydratedAggregate.productAndQuantity().get(productId)).isEqualTo(10);
        assertThat(rehydratedAggregate.uncommittedEvents()).isEmpty();
        assertThat(rehydratedAggregate.version()).isEqualTo(2);
        assertThat(rehydratedAggregate.hasBeenRehydrated()).isTrue();
    }

    @Test
    void test_rehydrating_aggregate_and_then_modifying_the_aggregate_state() {
        // Given
        var orderId   = OrderId.random();
        var productId = ProductId.random();

        var aggregate = new Order(orderId, CustomerId.random(), 123);
        aggregate.addProduct(productId, 10);

        // When
        var rehydratedAggregate = new Order().rehydrate(aggregate.uncommittedEvents());
        var newProductId        = ProductId.random();
        rehydratedAggregate.addProduct(newProductId, 3);

        // Then
        assertThat(rehydratedAggregate.uncommittedEvents().size()).isEqualTo(1);
        assertThat(rehydratedAggregate.version()).isEqualTo(3);

        var newProductAddedEvent = (ProductAddedToOrder) rehydratedAggregate.uncommittedEvents().get(0);
        assertThat((CharSequence) newProductAddedEvent.aggregateId()).isEqualTo(orderId);
        assertThat((CharSequence) newProductAddedEvent.getProductId()).isEqualTo(newProductId);
        assertThat(newProductAddedEvent.getQuantity()).isEqualTo(3);
        assertThat(newProductAddedEvent.version()).isEqualTo(3);

        assertThat(rehydratedAggregate.productAndQuantity().get(productId)).isEqualTo(10);
        assertThat(rehydratedAggregate.productAndQuantity().get(newProductId)).isEqualTo(3);
    }

    @Test
    void replaying_the_same_history_twice_yields_the_same_state() {
        // Given
        var history = orderHistory();

        // When
        var first  = new Order().rehydrate(history);
        var second = new Order().rehydrate(history);

        // Then
        assertThat(second.productAndQuantity()).isEqualTo(first.productAndQuantity());
        assertThat(second.isAccepted()).isEqualTo(first.isAccepted());
        assertThat(second.version()).isEqualTo(first.version());
        assertThat((CharSequence) second.aggregateId()).isEqualTo(first.aggregateId());
    }

    @Test
    void replaying_a_prefix_and_then_the_suffix_yields_the_same_state_as_replaying_the_full_history() {
        // Given
        var history = orderHistory();

        for (var split = 0; split <= history.size(); split++) {
            // When
            var full        = new Order().rehydrate(history);
            var incremental = new Order();
            incremental.loadFromEvents(history.subList(0, split));
            incremental.loadFromEvents(history.subList(split, history.size()));

            // Then
            assertThat(incremental.productAndQuantity()).as("split at %d", split).isEqualTo(full.productAndQuantity());
            assertThat(incremental.isAccepted()).as("split at %d", split).isEqualTo(full.isAccepted());
            assertThat(incremental.version()).as("split at %d", split).isEqualTo(full.version());
            assertThat(incremental.uncommittedEvents()).isEmpty();
        }
    }

    @Test
    void replaying_a_history_with_a_version_gap_fails() {
        // Given
        var history = new ArrayList<>(orderHistory());
        history.remove(1);

        // Then
        assertThatThrownBy(() -> new Order().rehydrate(history))
                .isInstanceOf(AggregateException.class)
                .hasMessageContaining("expected historic Event");
    }

    @Test
    void replaying_a_history_whose_first_event_lacks_the_aggregate_id_fails() {
        // Given
        var history = orderHistory();
        history.get(0).aggregateId(null);

        // Then
        assertThatThrownBy(() -> new Order().rehydrate(history))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static List<AggregateEvent<OrderId>> orderHistory() {
        var productId = ProductId.random();
        var order     = new Order(OrderId.random(), CustomerId.random(), 42);
        order.addProduct(productId, 1);
        order.addProduct(ProductId.random(), 7);
        order.adjustProductQuantity(productId, 4);
        order.accept();
        return new ArrayList<>(order.uncommittedEvents());
    }
}
