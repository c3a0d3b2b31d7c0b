package com.example.checkout.application.dto;

import com.example.checkout.domain.model.Order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Compact order listing entry.
 */
public record OrderSummary(
        String id,
        String orderNumber,
        String status,
        String paymentStatus,
        BigDecimal total,
        int itemCount,
        Instant createdAt
) {
    public static OrderSummary from(Order order) {
        return new OrderSummary(
                order.getId().getValue(),
                order.getOrderNumber().getValue(),
                order.getStatus().wireValue(),
                order.getPaymentStatus().wireValue(),
                order.getTotal().getAmount(),
                order.getItems().size(),
                order.getCreatedAt());
    }
}
