package com.example.checkout.domain.model;

/**
 * The two independently tracked status axes of an order.
 */
public enum StatusField {
    STATUS("status"),
    PAYMENT_STATUS("payment_status");

    private final String column;

    StatusField(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }
}
