package com.example.checkout.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record PaymentStatusRequest(
        @NotBlank(message = "Payment status is required")
        String paymentStatus
) {
}
