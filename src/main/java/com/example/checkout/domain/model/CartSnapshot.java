package com.example.checkout.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable copy of a cart's lines taken at a point in time.
 */
public record CartSnapshot(UUID cartId, UUID userId, List<CartLine> lines, Instant takenAt) {

    public CartSnapshot {
        Objects.requireNonNull(cartId, "Cart id cannot be null");
        Objects.requireNonNull(userId, "User id cannot be null");
        lines = List.copyOf(lines);
        Objects.requireNonNull(takenAt, "Snapshot time cannot be null");
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
