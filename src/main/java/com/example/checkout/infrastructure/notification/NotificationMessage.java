package com.example.checkout.infrastructure.notification;

import com.example.checkout.application.dto.OrderSummary;
import com.example.checkout.application.dto.OrderView;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JSON frame sent to WebSocket subscribers. Absent fields are omitted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationMessage(
        String type,
        @JsonProperty("order_id") String orderId,
        @JsonProperty("order_number") String orderNumber,
        String status,
        @JsonProperty("payment_status") String paymentStatus,
        @JsonProperty("event_type") String eventType,
        String message,
        @JsonProperty("total_amount") String totalAmount,
        @JsonProperty("checkout_id") String checkoutId,
        String stage,
        String error,
        @JsonProperty("created_at") String createdAt,
        String timestamp,
        List<OrderEntry> orders
) {

    public static final String ORDER_STATUS = "order_status";
    public static final String ORDER_STATUS_UPDATE = "order_status_update";
    public static final String ORDER_EVENT = "order_event";
    public static final String ORDERS_LIST = "orders_list";
    public static final String NEW_ORDER = "new_order";
    public static final String ORDER_UPDATE = "order_update";
    public static final String CHECKOUT_PROGRESS = "checkout_progress";

    /**
     * Entry of an {@code orders_list} frame.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OrderEntry(
            @JsonProperty("order_id") String orderId,
            @JsonProperty("order_number") String orderNumber,
            String status,
            @JsonProperty("payment_status") String paymentStatus,
            @JsonProperty("total_amount") String totalAmount,
            @JsonProperty("created_at") String createdAt
    ) {
        public static OrderEntry from(OrderSummary summary) {
            return new OrderEntry(summary.id(), summary.orderNumber(), summary.status(), summary.paymentStatus(),
                    summary.total().toPlainString(), summary.createdAt().toString());
        }
    }

    public static NotificationMessage orderStatus(OrderView order) {
        return new NotificationMessage(ORDER_STATUS, order.id(), order.orderNumber(), order.status(),
                order.paymentStatus(), null, null, order.total().toPlainString(), null, null, null,
                order.createdAt().toString(), null, null);
    }

    public static NotificationMessage orderStatusUpdate(Order order, Instant now) {
        return new NotificationMessage(ORDER_STATUS_UPDATE, order.getId().getValue(), null,
                order.getStatus().wireValue(), null, null, statusMessage(order), null, null, null, null, null,
                now.toString(), null);
    }

    public static NotificationMessage orderEvent(Order order, OrderEvent event) {
        return new NotificationMessage(ORDER_EVENT, order.getId().getValue(), null, null, null,
                event.type().wireValue(), event.message(), null, null, null, null, null,
                event.createdAt().toString(), null);
    }

    public static NotificationMessage ordersList(List<OrderSummary> orders) {
        return new NotificationMessage(ORDERS_LIST, null, null, null, null, null, null, null, null, null, null,
                null, null, orders.stream().map(OrderEntry::from).toList());
    }

    public static NotificationMessage newOrder(Order order, Instant now) {
        return new NotificationMessage(NEW_ORDER, order.getId().getValue(), order.getOrderNumber().getValue(),
                null, null, null, null, order.getTotal().getAmount().toPlainString(), null, null, null, null,
                now.toString(), null);
    }

    public static NotificationMessage orderUpdate(Order order, Instant now) {
        return new NotificationMessage(ORDER_UPDATE, order.getId().getValue(), null,
                order.getStatus().wireValue(), null, null, statusMessage(order), null, null, null, null, null,
                now.toString(), null);
    }

    public static NotificationMessage checkoutProgress(UUID checkoutId, String stage, String orderId,
                                                       String error, Instant now) {
        return new NotificationMessage(CHECKOUT_PROGRESS, orderId, null, null, null, null, null, null,
                checkoutId.toString(), stage, error, null, now.toString(), null);
    }

    public static NotificationMessage error(String error) {
        return new NotificationMessage(null, null, null, null, null, null, null, null, null, null, error,
                null, null, null);
    }

    private static String statusMessage(Order order) {
        return "Order " + order.getOrderNumber().getValue() + " is now " + order.getStatus().wireValue();
    }
}
