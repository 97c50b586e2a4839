package dk.cloudcreate.domainkit.eventsourced.aggregates.readmodel;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.OrderEvents.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class PatternMatchingReadModelBuilderTest {
    @Test
    void events_are_routed_to_the_matching_event_handler() {
        // Given
        var builder   = new OrderSummaryBuilder();
        var orderId   = OrderId.random();
        var productId = ProductId.random();

        // When
        builder.handle(new OrderAdded(orderId, CustomerId.random(), 1));
        var productAdded = new ProductAddedToOrder(productId, 2);
        productAdded.aggregateId(orderId);
        builder.handle(productAdded);
        var orderAccepted = new OrderAccepted();
        orderAccepted.aggregateId(orderId);
        builder.handle(orderAccepted);

        // Then
        assertThat(builder.numberOfProducts).containsExactly(entry(orderId, 2));
        assertThat(builder.unmatchedEvents).containsExactly(orderAccepted);
    }

    @Test
    void a_failing_event_handler_propagates_its_exception() {
        var builder = new OrderSummaryBuilder();
        var event   = new ProductAddedToOrder(ProductId.random(), -1);

        assertThatThrownBy(() -> builder.handle(event))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quantity");
    }

    private static class OrderSummaryBuilder extends PatternMatchingReadModelBuilder {
        final Map<OrderId, Integer>   numberOfProducts = new HashMap<>();
        final List<AggregateEvent<?>> unmatchedEvents  = new ArrayList<>();

        @EventHandler
        private void on(OrderAdded e) {
            numberOfProducts.put(e.aggregateId(), 0);
        }

        @EventHandler
        private void on(ProductAddedToOrder e) {
            if (e.getQuantity() < 0) {
                throw new IllegalArgumentException("Negative quantity");
            }
            numberOfProducts.merge(e.aggregateId(), e.getQuantity(), Integer::sum);
        }

        @Override
        protected void handleUnmatchedEvent(AggregateEvent<?> event) {
            unmatchedEvents.add(event);
        }
    }
}
