package dk.cloudcreate.toggles.eventsourced.aggregates.test_data;

import com.fasterxml.jackson.annotation.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = OrderEvent.OrderAdded.class, name = "OrderAdded"),
        @JsonSubTypes.Type(value = OrderEvent.ProductAdded.class, name = "ProductAdded"),
        @JsonSubTypes.Type(value = OrderEvent.OrderAccepted.class, name = "OrderAccepted")
})
public abstract class OrderEvent {
    public abstract String eventType();

    public static class OrderAdded extends OrderEvent {
        public final OrderId orderId;
        public final long    orderNumber;

        @JsonCreator
        public OrderAdded(@JsonProperty("orderId") OrderId orderId, @JsonProperty("orderNumber") long orderNumber) {
            this.orderId = requireNonNull(orderId, "No orderId provided");
            this.orderNumber = orderNumber;
        }

        @Override
        public String eventType() {
            return "OrderAdded";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OrderAdded)) return false;
            OrderAdded that = (OrderAdded) o;
            return orderNumber == that.orderNumber && Objects.equals(orderId, that.orderId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(orderId, orderNumber);
        }

        @Override
        public String toString() {
            return "OrderAdded{orderId=" + orderId + ", orderNumber=" + orderNumber + '}';
        }
    }

    public static class ProductAdded extends OrderEvent {
        public final String product;
        public final int    quantity;

        @JsonCreator
        public ProductAdded(@JsonProperty("product") String product, @JsonProperty("quantity") int quantity) {
            this.product = product;
            this.quantity = quantity;
        }

        @Override
        public String eventType() {
            return "ProductAdded";
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ProductAdded)) return false;
            ProductAdded that = (ProductAdded) o;
            return quantity == that.quantity && Objects.equals(product, that.product);
        }

        @Override
        public int hashCode() {
            return Objects.hash(product, quantity);
        }

        @Override
        public String toString() {
            return "ProductAdded{product='" + product + "', quantity=" + quantity + '}';
        }
    }

    public static class OrderAccepted extends OrderEvent {
        @Override
        public String eventType() {
            return "OrderAccepted";
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof OrderAccepted;
        }

        @Override
        public int hashCode() {
            return OrderAccepted.class.hashCode();
        }

        @Override
        public String toString() {
            return "OrderAccepted";
        }
    }
}
