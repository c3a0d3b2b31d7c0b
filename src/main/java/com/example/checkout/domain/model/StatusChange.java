package com.example.checkout.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of an order's append-only status history.
 *
 * @param field     which axis changed
 * @param from      previous wire value
 * @param to        new wire value
 * @param changedBy acting user id, {@code null} for system-driven changes
 */
public record StatusChange(
        StatusField field,
        String from,
        String to,
        String notes,
        String changedBy,
        Instant changedAt
) {
    public StatusChange {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(to, "Target status cannot be null");
        Objects.requireNonNull(changedAt, "Change time cannot be null");
    }
}
