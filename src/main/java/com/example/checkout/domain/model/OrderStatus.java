package com.example.checkout.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fulfilment status of an order.
 */
public enum OrderStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    CONFIRMED("confirmed"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    CANCELLED("cancelled"),
    REFUNDED("refunded");

    private final String wireValue;

    OrderStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public Set<OrderStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, CONFIRMED, CANCELLED);
            case PROCESSING -> EnumSet.of(CONFIRMED, CANCELLED);
            case CONFIRMED -> EnumSet.of(SHIPPED, CANCELLED);
            case SHIPPED -> EnumSet.of(DELIVERED);
            case DELIVERED -> EnumSet.of(REFUNDED);
            case CANCELLED, REFUNDED -> EnumSet.noneOf(OrderStatus.class);
        };
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTargets().contains(target);
    }

    /**
     * Whether stock for the order's items has been taken from the ledger.
     */
    public boolean holdsStock() {
        return this == CONFIRMED || this == SHIPPED || this == DELIVERED;
    }

    public static OrderStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + value));
    }
}
