package com.example.checkout.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Entry of an order's append-only event log.
 */
public record OrderEvent(OrderEventType type, String message, Map<String, Object> metadata, Instant createdAt) {

    public OrderEvent {
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(message, "Event message cannot be null");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        Objects.requireNonNull(createdAt, "Event time cannot be null");
    }
}
