package com.example.checkout.domain.model;

/**
 * Kind of row that carries a stock counter.
 */
public enum StockUnitType {
    PRODUCT,
    VARIANT
}
