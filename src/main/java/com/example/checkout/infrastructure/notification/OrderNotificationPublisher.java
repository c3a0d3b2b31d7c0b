package com.example.checkout.infrastructure.notification;

import com.example.checkout.application.port.out.OrderNotificationPort;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.UUID;

/**
 * Publishes order notifications to the hub once the surrounding transaction has committed.
 * Outside a transaction messages go out immediately. Nothing is sent for rolled-back work.
 */
@Component
public class OrderNotificationPublisher implements OrderNotificationPort {

    private static final Logger log = LoggerFactory.getLogger(OrderNotificationPublisher.class);

    private final NotificationHub hub;
    private final Clock clock;

    public OrderNotificationPublisher(NotificationHub hub, Clock clock) {
        this.hub = hub;
        this.clock = clock;
    }

    @Override
    public void orderCreated(Order order) {
        NotificationMessage message = NotificationMessage.newOrder(order, clock.instant());
        afterCommit(() -> hub.publish(TopicKey.userOrders(order.getUserId()), message));
    }

    @Override
    public void statusChanged(Order order) {
        NotificationMessage statusUpdate = NotificationMessage.orderStatusUpdate(order, clock.instant());
        NotificationMessage userUpdate = NotificationMessage.orderUpdate(order, clock.instant());
        afterCommit(() -> {
            hub.publish(TopicKey.order(order.getId().getValue()), statusUpdate);
            hub.publish(TopicKey.userOrders(order.getUserId()), userUpdate);
        });
    }

    @Override
    public void eventRecorded(Order order, OrderEvent event) {
        NotificationMessage message = NotificationMessage.orderEvent(order, event);
        afterCommit(() -> hub.publish(TopicKey.order(order.getId().getValue()), message));
    }

    @Override
    public void checkoutProgress(UUID userId, UUID checkoutId, String stage, String orderId, String error) {
        NotificationMessage message = NotificationMessage.checkoutProgress(
                checkoutId, stage, orderId, error, clock.instant());
        afterCommit(() -> hub.publish(TopicKey.userOrders(userId), message));
    }

    private void afterCommit(Runnable publish) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    safely(publish);
                }
            });
        } else {
            safely(publish);
        }
    }

    private static void safely(Runnable publish) {
        try {
            publish.run();
        } catch (RuntimeException e) {
            log.warn("Dropped order notification: {}", e.getMessage(), e);
        }
    }
}
