package com.example.checkout.infrastructure.persistence.entity;

public enum ProductStatus {
    DRAFT,
    ACTIVE,
    INACTIVE,
    DISCONTINUED
}
