package dk.cloudcreate.toggles.eventsourced.aggregates.test_data;

import dk.cloudcreate.toggles.eventsourced.aggregates.*;
import dk.cloudcreate.toggles.eventstore.postgresql.types.Generation;

import java.util.*;

public class Order implements Aggregate<OrderId, Order> {
    public static final EventApplier<OrderEvent, Order> APPLIER = Order::applyEvent;

    public final OrderId              id;
    public final Generation           generation;
    public final long                 orderNumber;
    public final Map<String, Integer> products;
    public final boolean              accepted;

    private Order(OrderId id, Generation generation, long orderNumber, Map<String, Integer> products, boolean accepted) {
        this.id = id;
        this.generation = generation;
        this.orderNumber = orderNumber;
        this.products = Collections.unmodifiableMap(products);
        this.accepted = accepted;
    }

    public static Order applyEvent(Optional<Order> currentState, OrderEvent event) {
        if (currentState.isEmpty()) {
            if (event instanceof OrderEvent.OrderAdded) {
                var added = (OrderEvent.OrderAdded) event;
                return new Order(added.orderId, Generation.first(), added.orderNumber, new LinkedHashMap<>(), false);
            }
            throw new InvalidStateEventException(currentState, event);
        }

        var order = currentState.get();
        if (event instanceof OrderEvent.ProductAdded && !order.accepted) {
            var productAdded = (OrderEvent.ProductAdded) event;
            var products     = new LinkedHashMap<>(order.products);
            products.merge(productAdded.product, productAdded.quantity, Integer::sum);
            return new Order(order.id, order.generation.next(), order.orderNumber, products, false);
        }
        if (event instanceof OrderEvent.OrderAccepted && !order.accepted) {
            return new Order(order.id, order.generation.next(), order.orderNumber, new LinkedHashMap<>(order.products), true);
        }
        throw new InvalidStateEventException(currentState, event);
    }

    @Override
    public OrderId aggregateId() {
        return id;
    }

    @Override
    public Generation generation() {
        return generation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order)) return false;
        Order order = (Order) o;
        return orderNumber == order.orderNumber &&
                accepted == order.accepted &&
                id.equals(order.id) &&
                generation.equals(order.generation) &&
                products.equals(order.products);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, generation, orderNumber, products, accepted);
    }

    @Override
    public String toString() {
        return "Order{id=" + id + ", generation=" + generation + ", orderNumber=" + orderNumber + ", products=" + products + ", accepted=" + accepted + '}';
    }
}
