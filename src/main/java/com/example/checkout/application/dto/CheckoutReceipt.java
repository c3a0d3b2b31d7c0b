package com.example.checkout.application.dto;

import com.example.checkout.domain.model.CheckoutAttempt;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of a checkout submission or status query.
 *
 * @param duplicate true when the idempotency key matched an earlier submission
 */
public record CheckoutReceipt(
        UUID checkoutId,
        String status,
        String orderId,
        String failureReason,
        Instant createdAt,
        Instant updatedAt,
        boolean duplicate
) {
    public static CheckoutReceipt accepted(CheckoutAttempt attempt) {
        return from(attempt, false);
    }

    public static CheckoutReceipt duplicate(CheckoutAttempt attempt) {
        return from(attempt, true);
    }

    public static CheckoutReceipt from(CheckoutAttempt attempt, boolean duplicate) {
        return new CheckoutReceipt(attempt.checkoutId(), attempt.status().wireValue(), attempt.orderId(),
                attempt.failureReason(), attempt.createdAt(), attempt.updatedAt(), duplicate);
    }
}
