package com.example.checkout.application.pipeline;

import com.example.checkout.domain.model.Address;
import com.example.checkout.domain.model.CartLine;

import java.util.List;
import java.util.UUID;

/**
 * Input of the validate-inventory stage: the cart snapshot plus the customer's checkout details.
 */
public record CheckoutRequest(
        UUID checkoutId,
        UUID userId,
        UUID cartId,
        List<CartLine> lines,
        Address shippingAddress,
        Address billingAddress,
        String notes
) implements CheckoutPayload {

    public CheckoutRequest {
        lines = List.copyOf(lines);
    }
}
