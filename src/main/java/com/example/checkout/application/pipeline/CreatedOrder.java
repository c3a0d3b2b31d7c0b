package com.example.checkout.application.pipeline;

import java.util.UUID;

public record CreatedOrder(
        UUID checkoutId,
        UUID userId,
        UUID cartId,
        String orderId,
        String orderNumber
) implements CheckoutPayload {
}
