package com.example.checkout.application.pipeline;

import java.time.Instant;
import java.util.UUID;

public record CheckoutCompleted(
        UUID checkoutId,
        UUID userId,
        String orderId,
        String orderNumber,
        Instant completedAt
) implements CheckoutPayload {
}
