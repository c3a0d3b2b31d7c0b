package com.example.checkout.domain.exception;

/**
 * A checkout submission that cannot be accepted for processing.
 */
public class CheckoutRejectedException extends DomainException {

    public CheckoutRejectedException(String message) {
        super("CHECKOUT_REJECTED", message);
    }
}
