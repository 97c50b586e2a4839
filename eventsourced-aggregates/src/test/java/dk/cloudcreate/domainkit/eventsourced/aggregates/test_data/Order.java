package dk.cloudcreate.domainkit.eventsourced.aggregates.test_data;

import dk.cloudcreate.domainkit.eventsourced.aggregates.*;
import dk.cloudcreate.domainkit.eventsourced.aggregates.test_data.OrderEvents.*;

import java.util.*;

import static dk.cloudcreate.domainkit.common.FailFast.requireNonNull;

/**
 * Example Order aggregate
 */
public class Order extends EventSourcedAggregateRoot<OrderId, Order> {
    public static final AggregateType ORDERS = AggregateType.of("Orders");

    Map<ProductId, Integer> productAndQuantity;
    boolean                 accepted;

    public Order() {
    }

    public Order(OrderId orderId,
                 CustomerId orderingCustomerId,
                 int orderNumber) {
        // orderId may be null to test the initial event validation
        requireNonNull(orderingCustomerId, "You must provide an orderingCustomerId");
        create(orderId, orderingCustomerId, orderNumber);
    }

    /**
     * Command used when the order is a blank instance created by a repository
     */
    public void create(OrderId orderId, CustomerId orderingCustomerId, int orderNumber) {
        if (version() != NO_EVENTS_HAVE_BEEN_APPLIED) {
            throw new IllegalStateException("Order has already been created");
        }
        apply(new OrderAdded(orderId,
                             orderingCustomerId,
                             orderNumber));
    }

    public void addProduct(ProductId productId, int quantity) {
        requireNonNull(productId, "You must provide a productId");
        if (accepted) {
            throw new IllegalStateException("Order is already accepted");
        }
        apply(new ProductAddedToOrder(productId, quantity));
    }

    public void adjustProductQuantity(ProductId productId, int newQuantity) {
        requireNonNull(productId, "You must provide a productId");
        if (accepted) {
            throw new IllegalStateException("Order is already accepted");
        }
        if (productAndQuantity.containsKey(productId)) {
            apply(new ProductOrderQuantityAdjusted(productId, newQuantity));
        }
    }

    public void removeProduct(ProductId productId) {
        requireNonNull(productId, "You must provide a productId");
        if (accepted) {
            throw new IllegalStateException("Order is already accepted");
        }
        if (productAndQuantity.containsKey(productId)) {
            apply(new ProductRemovedFromOrder(productId));
        }
    }

    public void accept() {
        if (accepted) {
            return;
        }
        apply(new OrderAccepted());
    }

    public Map<ProductId, Integer> productAndQuantity() {
        return productAndQuantity;
    }

    public boolean isAccepted() {
        return accepted;
    }

    @EventHandler
    private void on(OrderAdded e) {
        productAndQuantity = new HashMap<>();
    }

    @EventHandler
    private void on(ProductAddedToOrder e) {
        var existingQuantity = productAndQuantity.get(e.getProductId());
        productAndQuantity.put(e.getProductId(), e.getQuantity() + (existingQuantity != null ? existingQuantity : 0));
    }

    @EventHandler
    private void on(ProductOrderQuantityAdjusted e) {
        productAndQuantity.put(e.getProductId(), e.getNewQuantity());
    }

    @EventHandler
    private void on(ProductRemovedFromOrder e) {
        productAndQuantity.remove(e.getProductId());
    }

    @EventHandler
    private void on(OrderAccepted e) {
        accepted = true;
    }
}
