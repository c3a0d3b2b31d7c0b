package com.example.checkout.infrastructure.adapter.in.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO describing a checkout attempt.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckoutResponse(
        UUID checkoutId,
        String status,
        String orderId,
        String failureReason,
        Instant createdAt,
        Instant updatedAt
) {
}
