package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.StockUnitRef;

/**
 * Outbound port for the authoritative per-unit stock counters.
 * <p>
 * Mutating calls must run inside the caller's transaction. The unit row stays locked until
 * that transaction ends, so concurrent mutations of the same unit are serialized.
 */
public interface StockLedgerPort {

    /**
     * Decrements the unit's stock.
     *
     * @throws com.example.checkout.domain.exception.InsufficientStockException if quantity exceeds the current stock;
     *         the counter is left unchanged
     */
    StockChange reduce(StockUnitRef unit, int quantity);

    /**
     * Increments the unit's stock. Used for restock on cancellation.
     */
    StockChange increase(StockUnitRef unit, int quantity);

    /**
     * Overwrites the unit's stock with an absolute value.
     */
    StockChange set(StockUnitRef unit, int quantity);

    /**
     * Advisory read: true when the unit does not track inventory or has stock left.
     */
    boolean isInStock(StockUnitRef unit);

    /**
     * Advisory read of the available quantity; {@link Integer#MAX_VALUE} for untracked units.
     */
    int available(StockUnitRef unit);

    /**
     * Result of a ledger mutation.
     */
    record StockChange(StockUnitRef unit, int oldQuantity, int newQuantity) {

        public int delta() {
            return newQuantity - oldQuantity;
        }
    }
}
