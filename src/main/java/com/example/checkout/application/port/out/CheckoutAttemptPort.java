package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CheckoutAttempt;
import com.example.checkout.domain.model.CheckoutStatus;

import java.util.Optional;
import java.util.UUID;

/**
 * Outbound port for checkout attempt records.
 */
public interface CheckoutAttemptPort {

    CheckoutAttempt save(CheckoutAttempt attempt);

    Optional<CheckoutAttempt> findById(UUID checkoutId);

    Optional<CheckoutAttempt> findByIdempotencyKey(String idempotencyKey);

    boolean hasAttemptInFlight(UUID cartId);

    void advance(UUID checkoutId, CheckoutStatus status, String orderId);

    void markFailed(UUID checkoutId, String reason);
}
