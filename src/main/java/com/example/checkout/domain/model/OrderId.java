package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Value Object representing the surrogate identity of an order.
 */
public final class OrderId {

    private final String value;

    private OrderId(String value) {
        this.value = Objects.requireNonNull(value, "OrderId value cannot be null");
    }

    /**
     * Creates an OrderId from a UUID string.
     *
     * @throws IllegalArgumentException if value is not a valid UUID
     */
    public static OrderId of(String value) {
        Objects.requireNonNull(value, "OrderId value cannot be null");
        try {
            return new OrderId(UUID.fromString(value).toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid OrderId format: " + value, e);
        }
    }

    public static OrderId of(UUID value) {
        return new OrderId(value.toString());
    }

    public static OrderId generate() {
        return new OrderId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderId orderId = (OrderId) o;
        return Objects.equals(value, orderId.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
