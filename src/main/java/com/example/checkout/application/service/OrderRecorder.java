package com.example.checkout.application.service;

import com.example.checkout.application.port.out.AuditPort;
import com.example.checkout.application.port.out.AuditPort.AuditEntry;
import com.example.checkout.application.port.out.OrderNotificationPort;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderEvent;
import com.example.checkout.domain.model.StatusChange;
import com.example.checkout.domain.model.StatusField;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Saves an order and fans its unsaved changes out to the audit trail and to subscribers.
 * Notifications are delivered after the surrounding transaction commits.
 */
@Component
public class OrderRecorder {

    private final OrderStorePort orderStore;
    private final AuditPort auditPort;
    private final OrderNotificationPort notifications;

    public OrderRecorder(OrderStorePort orderStore, AuditPort auditPort, OrderNotificationPort notifications) {
        this.orderStore = orderStore;
        this.auditPort = auditPort;
        this.notifications = notifications;
    }

    public Order persist(Order order, Actor actor) {
        boolean created = order.isNew();
        List<StatusChange> changes = order.getNewStatusChanges();
        List<OrderEvent> events = order.getNewEvents();

        Order saved = orderStore.save(order);
        String orderId = saved.getId().getValue();

        if (created) {
            auditPort.record(AuditEntry.created("Order", orderId, actor, Map.of(
                    "order_number", saved.getOrderNumber().getValue(),
                    "total", saved.getTotal().getAmount().toPlainString(),
                    "checkout_id", saved.getCheckoutId().toString())));
            notifications.orderCreated(saved);
        }
        changes.forEach(change -> auditPort.record(AuditEntry.statusChange(orderId, change)));
        if (changes.stream().anyMatch(c -> c.field() == StatusField.STATUS)) {
            notifications.statusChanged(saved);
        }
        events.forEach(event -> notifications.eventRecorded(saved, event));
        return saved;
    }
}
