package com.example.checkout.application.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ValidatedCheckout(
        CheckoutRequest request,
        List<ValidatedLine> lines,
        Instant validatedAt
) implements CheckoutPayload {

    public ValidatedCheckout {
        lines = List.copyOf(lines);
    }

    @Override
    public UUID checkoutId() {
        return request.checkoutId();
    }

    @Override
    public UUID userId() {
        return request.userId();
    }
}
