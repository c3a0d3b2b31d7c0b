package com.example.checkout.domain.model;

import java.util.Objects;

/**
 * Amounts added to or removed from an order's subtotal. Tax and shipping are flat zero until
 * a pricing collaborator supplies them.
 */
public record OrderCharges(Money tax, Money shipping, Money discount) {

    public OrderCharges {
        Objects.requireNonNull(tax, "Tax cannot be null");
        Objects.requireNonNull(shipping, "Shipping cannot be null");
        Objects.requireNonNull(discount, "Discount cannot be null");
    }

    public static OrderCharges none(String currency) {
        Money zero = Money.zero(currency);
        return new OrderCharges(zero, zero, zero);
    }
}
