package com.example.checkout.infrastructure.adapter.out.accounts.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO from the accounts service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountResponse(
        String id,
        String email,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("is_active") boolean active
) {
}
