package com.example.checkout.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Payment axis of an order, tracked independently from {@link OrderStatus}.
 */
public enum PaymentStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    PAID("paid"),
    FAILED("failed"),
    REFUNDED("refunded"),
    PARTIALLY_REFUNDED("partially_refunded");

    private final String wireValue;

    PaymentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public Set<PaymentStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING, PAID, FAILED);
            case PROCESSING -> EnumSet.of(PAID, FAILED);
            case FAILED -> EnumSet.of(PROCESSING);
            case PAID -> EnumSet.of(REFUNDED, PARTIALLY_REFUNDED);
            case PARTIALLY_REFUNDED -> EnumSet.of(REFUNDED);
            case REFUNDED -> EnumSet.noneOf(PaymentStatus.class);
        };
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return allowedTargets().contains(target);
    }

    public static PaymentStatus fromWireValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment status: " + value));
    }
}
