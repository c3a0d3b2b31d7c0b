package com.example.checkout.infrastructure.persistence.entity;

/**
 * Status of a queued pipeline step.
 */
public enum CheckoutTaskStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
