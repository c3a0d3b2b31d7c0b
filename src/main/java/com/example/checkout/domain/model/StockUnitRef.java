package com.example.checkout.domain.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifies one stock counter in the ledger: a variant when the line names one, else the product.
 * Natural ordering is the order in which rows are locked.
 */
public record StockUnitRef(StockUnitType type, UUID id) implements Comparable<StockUnitRef> {

    private static final Comparator<StockUnitRef> LOCK_ORDER =
            Comparator.comparing(StockUnitRef::type).thenComparing(StockUnitRef::id);

    public StockUnitRef {
        Objects.requireNonNull(type, "Stock unit type cannot be null");
        Objects.requireNonNull(id, "Stock unit id cannot be null");
    }

    public static StockUnitRef product(UUID productId) {
        return new StockUnitRef(StockUnitType.PRODUCT, productId);
    }

    public static StockUnitRef variant(UUID variantId) {
        return new StockUnitRef(StockUnitType.VARIANT, variantId);
    }

    public static StockUnitRef forLine(UUID productId, UUID variantId) {
        return variantId != null ? variant(variantId) : product(productId);
    }

    @Override
    public int compareTo(StockUnitRef other) {
        return LOCK_ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + id;
    }
}
