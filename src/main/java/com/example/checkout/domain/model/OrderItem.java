package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Line of an order. Product name, sku and price are copied at order time and never re-read
 * from the catalog; {@code totalPrice} is computed once on creation.
 */
public final class OrderItem {

    private final UUID productId;
    private final UUID variantId;
    private final String productName;
    private final String variantName;
    private final String sku;
    private final int quantity;
    private final Money unitPrice;
    private final Money totalPrice;

    private OrderItem(UUID productId, UUID variantId, String productName, String variantName,
                      String sku, int quantity, Money unitPrice, Money totalPrice) {
        this.productId = Objects.requireNonNull(productId, "ProductId cannot be null");
        this.variantId = variantId;
        this.productName = Objects.requireNonNull(productName, "Product name cannot be null");
        this.variantName = variantName;
        this.sku = Objects.requireNonNull(sku, "Sku cannot be null");
        this.unitPrice = Objects.requireNonNull(unitPrice, "Unit price cannot be null");
        this.totalPrice = Objects.requireNonNull(totalPrice, "Total price cannot be null");
        this.quantity = quantity;

        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    /**
     * Creates an item from catalog data captured now.
     */
    public static OrderItem snapshot(UUID productId, UUID variantId, String productName, String variantName,
                                     String sku, int quantity, Money unitPrice) {
        Objects.requireNonNull(unitPrice, "Unit price cannot be null");
        return new OrderItem(productId, variantId, productName, variantName, sku, quantity,
                unitPrice, unitPrice.multiply(quantity));
    }

    /**
     * Reconstitutes an item from persistence, keeping the stored total as-is.
     */
    public static OrderItem reconstitute(UUID productId, UUID variantId, String productName, String variantName,
                                         String sku, int quantity, Money unitPrice, Money totalPrice) {
        return new OrderItem(productId, variantId, productName, variantName, sku, quantity, unitPrice, totalPrice);
    }

    public StockUnitRef stockUnit() {
        return StockUnitRef.forLine(productId, variantId);
    }

    public String displayName() {
        return variantName != null ? productName + " (" + variantName + ")" : productName;
    }

    public UUID getProductId() {
        return productId;
    }

    public UUID getVariantId() {
        return variantId;
    }

    public String getProductName() {
        return productName;
    }

    public String getVariantName() {
        return variantName;
    }

    public String getSku() {
        return sku;
    }

    public int getQuantity() {
        return quantity;
    }

    public Money getUnitPrice() {
        return unitPrice;
    }

    public Money getTotalPrice() {
        return totalPrice;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderItem that = (OrderItem) o;
        return quantity == that.quantity
                && Objects.equals(productId, that.productId)
                && Objects.equals(variantId, that.variantId)
                && Objects.equals(sku, that.sku)
                && Objects.equals(unitPrice, that.unitPrice);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId, variantId, sku, quantity, unitPrice);
    }

    @Override
    public String toString() {
        return "OrderItem{sku=" + sku + ", quantity=" + quantity + ", unitPrice=" + unitPrice + "}";
    }
}
