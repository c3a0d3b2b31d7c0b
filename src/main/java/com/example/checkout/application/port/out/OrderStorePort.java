package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderNumber;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Outbound port for order persistence.
 */
public interface OrderStorePort {

    Optional<Order> findById(OrderId orderId);

    /**
     * Loads the order and holds a row lock on it until the surrounding transaction ends.
     */
    Optional<Order> findByIdForUpdate(OrderId orderId);

    Optional<Order> findByCheckoutId(UUID checkoutId);

    List<Order> findRecentByUser(UUID userId, int limit);

    boolean existsByOrderNumber(OrderNumber orderNumber);

    /**
     * Writes the order together with its unsaved history rows and events.
     */
    Order save(Order order);
}
