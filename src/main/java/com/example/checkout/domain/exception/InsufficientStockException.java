package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.StockUnitRef;

/**
 * Exception thrown when a ledger deduction asks for more than is available.
 */
public class InsufficientStockException extends DomainException {

    private final StockUnitRef unit;
    private final int requestedQuantity;
    private final int availableQuantity;

    public InsufficientStockException(StockUnitRef unit, int requestedQuantity, int availableQuantity) {
        super("INSUFFICIENT_STOCK", String.format("Insufficient stock for %s: requested %d, available %d",
                unit, requestedQuantity, availableQuantity));
        this.unit = unit;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public StockUnitRef getUnit() {
        return unit;
    }

    public int getRequestedQuantity() {
        return requestedQuantity;
    }

    public int getAvailableQuantity() {
        return availableQuantity;
    }
}
