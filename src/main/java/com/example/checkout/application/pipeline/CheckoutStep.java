package com.example.checkout.application.pipeline;

import com.example.checkout.domain.model.CheckoutStatus;

import java.util.Optional;

/**
 * The ordered steps of the checkout pipeline.
 */
public enum CheckoutStep {
    VALIDATE_INVENTORY(CheckoutStatus.VALIDATED),
    CREATE_ORDER(CheckoutStatus.CREATED),
    DEDUCT_STOCK(CheckoutStatus.STOCK_DEDUCTED),
    SEND_CONFIRMATION(CheckoutStatus.COMPLETED);

    private final CheckoutStatus completedStatus;

    CheckoutStep(CheckoutStatus completedStatus) {
        this.completedStatus = completedStatus;
    }

    /**
     * Attempt status reached once this step has succeeded.
     */
    public CheckoutStatus completedStatus() {
        return completedStatus;
    }

    public Optional<CheckoutStep> next() {
        int nextIndex = ordinal() + 1;
        CheckoutStep[] steps = values();
        return nextIndex < steps.length ? Optional.of(steps[nextIndex]) : Optional.empty();
    }
}
