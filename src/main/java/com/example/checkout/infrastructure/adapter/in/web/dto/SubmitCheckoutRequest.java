package com.example.checkout.infrastructure.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for checking out the caller's cart. Billing defaults to the shipping address.
 */
public record SubmitCheckoutRequest(
        @NotNull(message = "Shipping address is required")
        @Valid
        AddressRequest shippingAddress,

        @Valid
        AddressRequest billingAddress,

        @Size(max = 1000, message = "Notes must be at most 1000 characters")
        String notes
) {
}
