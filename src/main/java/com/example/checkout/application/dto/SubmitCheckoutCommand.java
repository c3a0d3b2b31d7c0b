package com.example.checkout.application.dto;

import com.example.checkout.domain.model.Address;

import java.util.Objects;
import java.util.UUID;

/**
 * Command to start a checkout of the user's cart.
 */
public record SubmitCheckoutCommand(
        UUID userId,
        String idempotencyKey,
        Address shippingAddress,
        Address billingAddress,
        String notes
) {
    public SubmitCheckoutCommand {
        Objects.requireNonNull(userId, "UserId cannot be null");
        Objects.requireNonNull(idempotencyKey, "Idempotency key cannot be null");
        Objects.requireNonNull(shippingAddress, "Shipping address cannot be null");
        if (billingAddress == null) {
            billingAddress = shippingAddress;
        }
    }
}
