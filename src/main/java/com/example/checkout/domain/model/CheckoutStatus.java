package com.example.checkout.domain.model;

/**
 * Progress of a checkout attempt through the pipeline.
 */
public enum CheckoutStatus {
    ACCEPTED("accepted"),
    VALIDATED("validated"),
    CREATED("created"),
    STOCK_DEDUCTED("stock_deducted"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    CheckoutStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
