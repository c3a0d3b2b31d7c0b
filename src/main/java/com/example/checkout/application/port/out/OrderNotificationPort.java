package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderEvent;

import java.util.UUID;

/**
 * Outbound port for real-time notifications. Implementations are best-effort and never throw.
 */
public interface OrderNotificationPort {

    void orderCreated(Order order);

    void statusChanged(Order order);

    void eventRecorded(Order order, OrderEvent event);

    /**
     * Reports that a checkout reached {@code stage}; {@code error} is set only for failures.
     */
    void checkoutProgress(UUID userId, UUID checkoutId, String stage, String orderId, String error);
}
