package com.example.checkout.application.dto;

import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderEvent;
import com.example.checkout.domain.model.OrderItem;
import com.example.checkout.domain.model.StatusChange;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read model of an order with its items, status history and events.
 */
public record OrderView(
        String id,
        String orderNumber,
        UUID userId,
        String status,
        String paymentStatus,
        BigDecimal subtotal,
        BigDecimal tax,
        BigDecimal shipping,
        BigDecimal discount,
        BigDecimal total,
        String currency,
        Address shippingAddress,
        Address billingAddress,
        String notes,
        String trackingNumber,
        Instant shippedAt,
        Instant deliveredAt,
        Instant createdAt,
        boolean cancellable,
        List<Item> items,
        List<History> statusHistory,
        List<Event> events
) {

    public static OrderView from(Order order) {
        return new OrderView(
                order.getId().getValue(),
                order.getOrderNumber().getValue(),
                order.getUserId(),
                order.getStatus().wireValue(),
                order.getPaymentStatus().wireValue(),
                order.getSubtotal().getAmount(),
                order.getTax().getAmount(),
                order.getShippingCost().getAmount(),
                order.getDiscount().getAmount(),
                order.getTotal().getAmount(),
                order.getTotal().getCurrency(),
                order.getShippingAddress(),
                order.getBillingAddress(),
                order.getNotes(),
                order.getTrackingNumber(),
                order.getShippedAt(),
                order.getDeliveredAt(),
                order.getCreatedAt(),
                order.canBeCancelled(),
                order.getItems().stream().map(Item::from).toList(),
                order.getStatusHistory().stream().map(History::from).toList(),
                order.getEvents().stream().map(Event::from).toList());
    }

    public record Item(UUID productId, UUID variantId, String productName, String variantName, String sku,
                       int quantity, BigDecimal unitPrice, BigDecimal totalPrice) {

        static Item from(OrderItem item) {
            return new Item(item.getProductId(), item.getVariantId(), item.getProductName(), item.getVariantName(),
                    item.getSku(), item.getQuantity(), item.getUnitPrice().getAmount(),
                    item.getTotalPrice().getAmount());
        }
    }

    public record History(String field, String from, String to, String notes, String changedBy, Instant changedAt) {

        static History from(StatusChange change) {
            return new History(change.field().column(), change.from(), change.to(), change.notes(),
                    change.changedBy(), change.changedAt());
        }
    }

    public record Event(String type, String message, Map<String, Object> metadata, Instant createdAt) {

        static Event from(OrderEvent event) {
            return new Event(event.type().wireValue(), event.message(), event.metadata(), event.createdAt());
        }
    }
}
