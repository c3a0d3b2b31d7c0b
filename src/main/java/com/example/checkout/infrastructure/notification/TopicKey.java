package com.example.checkout.infrastructure.notification;

import java.util.Objects;

/**
 * Address of a notification topic: one order, or all orders of one user.
 */
public record TopicKey(Scope scope, String id) {

    public enum Scope {
        ORDER,
        USER_ORDERS
    }

    public TopicKey {
        Objects.requireNonNull(scope, "Scope cannot be null");
        Objects.requireNonNull(id, "Topic id cannot be null");
    }

    public static TopicKey order(String orderId) {
        return new TopicKey(Scope.ORDER, orderId);
    }

    public static TopicKey userOrders(Object userId) {
        return new TopicKey(Scope.USER_ORDERS, String.valueOf(userId));
    }
}
