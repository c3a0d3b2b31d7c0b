package com.example.checkout.domain.exception;

import java.util.UUID;

public class CheckoutNotFoundException extends DomainException {

    public CheckoutNotFoundException(UUID checkoutId) {
        super("CHECKOUT_NOT_FOUND", "Checkout not found: " + checkoutId);
    }
}
