package com.example.checkout.domain.exception;

/**
 * A checkout broke a business rule: inactive product, out of stock, quantity too large, missing user.
 */
public class ValidationException extends DomainException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
