package com.example.checkout.infrastructure.adapter.in.websocket;

import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.infrastructure.notification.NotificationHub;
import com.example.checkout.infrastructure.notification.NotificationMessage;
import com.example.checkout.infrastructure.notification.TopicKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * {@code /ws/user-orders/{userId}}: new orders, status changes and checkout progress of one user.
 */
@Component
public class UserOrdersSocketHandler extends AbstractNotificationSocketHandler {

    static final int SNAPSHOT_SIZE = 10;

    private final OrderQueryUseCase orderQuery;

    public UserOrdersSocketHandler(NotificationHub hub, ObjectMapper objectMapper, OrderQueryUseCase orderQuery) {
        super(hub, objectMapper);
        this.orderQuery = orderQuery;
    }

    @Override
    protected Optional<TopicKey> authorize(UUID userId, String pathUserId) {
        if (!userId.toString().equalsIgnoreCase(pathUserId)) {
            return Optional.empty();
        }
        return Optional.of(TopicKey.userOrders(userId));
    }

    @Override
    protected NotificationMessage snapshot(UUID userId, String pathUserId) {
        return NotificationMessage.ordersList(orderQuery.recentOrders(userId, SNAPSHOT_SIZE));
    }

    @Override
    protected String refreshType() {
        return "get_orders";
    }
}
