package com.example.checkout.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One submitted checkout. Its {@code checkoutId} is the idempotency key of the create-order stage.
 */
public record CheckoutAttempt(
        UUID checkoutId,
        String idempotencyKey,
        UUID userId,
        UUID cartId,
        CheckoutStatus status,
        String orderId,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
    public CheckoutAttempt {
        Objects.requireNonNull(checkoutId, "CheckoutId cannot be null");
        Objects.requireNonNull(idempotencyKey, "Idempotency key cannot be null");
        Objects.requireNonNull(userId, "UserId cannot be null");
        Objects.requireNonNull(cartId, "CartId cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
    }

    public static CheckoutAttempt accept(String idempotencyKey, UUID userId, UUID cartId, Instant now) {
        return new CheckoutAttempt(UUID.randomUUID(), idempotencyKey, userId, cartId,
                CheckoutStatus.ACCEPTED, null, null, now, now);
    }
}
