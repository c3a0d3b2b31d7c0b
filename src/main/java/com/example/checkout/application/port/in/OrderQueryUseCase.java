package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.OrderSummary;
import com.example.checkout.application.dto.OrderView;
import com.example.checkout.domain.model.OrderId;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OrderQueryUseCase {

    /**
     * Returns the order only if it belongs to {@code userId}.
     */
    Optional<OrderView> findOwnedOrder(OrderId orderId, UUID userId);

    List<OrderSummary> recentOrders(UUID userId, int limit);
}
