package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * One line of a cart snapshot.
 */
public record CartLine(UUID productId, UUID variantId, int quantity) {

    public CartLine {
        Objects.requireNonNull(productId, "Product id cannot be null");
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1: " + quantity);
        }
    }

    public StockUnitRef stockUnit() {
        return StockUnitRef.forLine(productId, variantId);
    }
}
