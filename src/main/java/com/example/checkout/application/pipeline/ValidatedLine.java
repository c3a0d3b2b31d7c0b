package com.example.checkout.application.pipeline;

import com.example.checkout.domain.model.StockUnitType;

import java.util.UUID;

/**
 * Advisory result for one cart line. Not a reservation.
 */
public record ValidatedLine(
        StockUnitType unitType,
        UUID unitId,
        UUID productId,
        UUID variantId,
        int quantity,
        int availableAtValidation
) {
}
