package dk.cloudcreate.domainkit.eventsourced.aggregates.test_data;

import dk.cloudcreate.domainkit.eventsourced.aggregates.AggregateEvent;

public final class OrderEvents {
    public static class OrderAdded extends AggregateEvent<OrderId> {
        private CustomerId orderingCustomerId;
        private long       orderNumber;

        private OrderAdded() {
        }

        public OrderAdded(OrderId orderId, CustomerId orderingCustomerId, long orderNumber) {
            // MUST be set manually for the FIRST/INITIAL event
            super(orderId);
            this.orderingCustomerId = orderingCustomerId;
            this.orderNumber = orderNumber;
        }

        public CustomerId getOrderingCustomerId() {
            return orderingCustomerId;
        }

        public long getOrderNumber() {
            return orderNumber;
        }
    }

    public static class ProductAddedToOrder extends AggregateEvent<OrderId> {
        private ProductId productId;
        private int       quantity;

        private ProductAddedToOrder() {
        }

        public ProductAddedToOrder(ProductId productId, int quantity) {
            this.productId = productId;
            this.quantity = quantity;
        }

        public ProductId getProductId() {
            return productId;
        }

        public int getQuantity() {
            return quantity;
        }
    }

    public static class ProductOrderQuantityAdjusted extends AggregateEvent<OrderId> {
        private ProductId productId;
        private int       newQuantity;

        private ProductOrderQuantityAdjusted() {
        }

        public ProductOrderQuantityAdjusted(ProductId productId, int newQuantity) {
            this.productId = productId;
            this.newQuantity = newQuantity;
        }

        public ProductId getProductId() {
            return productId;
        }

        public int getNewQuantity() {
            return newQuantity;
        }
    }

    public static class ProductRemovedFromOrder extends AggregateEvent<OrderId> {
        private ProductId productId;

        private ProductRemovedFromOrder() {
        }

        public ProductRemovedFromOrder(ProductId productId) {
            this.productId = productId;
        }

        public ProductId getProductId() {
            return productId;
        }
    }

    public static class OrderAccepted extends AggregateEvent<OrderId> {
    }
}
