package com.example.checkout.infrastructure.adapter.in.websocket;

import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.infrastructure.notification.NotificationHub;
import com.example.checkout.infrastructure.notification.NotificationMessage;
import com.example.checkout.infrastructure.notification.TopicKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * {@code /ws/order/{orderId}}: status and event stream of one order, for its owner only.
 */
@Component
public class OrderStatusSocketHandler extends AbstractNotificationSocketHandler {

    private final OrderQueryUseCase orderQuery;

    public OrderStatusSocketHandler(NotificationHub hub, ObjectMapper objectMapper, OrderQueryUseCase orderQuery) {
        super(hub, objectMapper);
        this.orderQuery = orderQuery;
    }

    @Override
    protected Optional<TopicKey> authorize(UUID userId, String orderId) {
        OrderId id;
        try {
            id = OrderId.of(orderId);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return orderQuery.findOwnedOrder(id, userId)
                .map(order -> TopicKey.order(order.id()));
    }

    @Override
    protected NotificationMessage snapshot(UUID userId, String orderId) {
        return orderQuery.findOwnedOrder(OrderId.of(orderId), userId)
                .map(NotificationMessage::orderStatus)
                .orElse(null);
    }

    @Override
    protected String refreshType() {
        return "get_status";
    }
}
