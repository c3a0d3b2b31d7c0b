package com.example.checkout.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ShipOrderRequest(
        @NotBlank(message = "Tracking number is required")
        @Size(max = 100)
        String trackingNumber
) {
}
