package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.Money;

import java.util.Optional;
import java.util.UUID;

/**
 * Outbound port for product and variant data needed to validate and price cart lines.
 */
public interface CatalogPort {

    /**
     * Looks up a product, or one of its variants when {@code variantId} is given.
     */
    Optional<CatalogEntry> find(UUID productId, UUID variantId);

    /**
     * Price and naming data for one purchasable unit.
     */
    record CatalogEntry(
            UUID productId,
            UUID variantId,
            String productName,
            String variantName,
            String sku,
            Money unitPrice,
            boolean purchasable
    ) {
        public String displayName() {
            return variantName != null ? productName + " (" + variantName + ")" : productName;
        }
    }
}
