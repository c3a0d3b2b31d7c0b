package com.example.checkout.domain.model;

/**
 * Business milestones recorded against an order.
 */
public enum OrderEventType {
    CREATED("created"),
    PAYMENT_RECEIVED("payment_received"),
    PAYMENT_FAILED("payment_failed"),
    CONFIRMED("confirmed"),
    CONFIRMATION_SENT("confirmation_sent"),
    SHIPPED("shipped"),
    DELIVERED("delivered"),
    CANCELLED("cancelled"),
    REFUNDED("refunded"),
    NOTE_ADDED("note_added");

    private final String wireValue;

    OrderEventType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }
}
