package com.example.checkout.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value Object representing a non-negative monetary amount with currency.
 */
public final class Money {

    public static final String DEFAULT_CURRENCY = "USD";
    private static final int SCALE = 2;

    private final BigDecimal amount;
    private final String currency;

    private Money(BigDecimal amount, String currency) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
    }

    /**
     * Creates Money with the specified amount and default currency (USD).
     *
     * @param amount the monetary amount
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money of(BigDecimal amount) {
        return of(amount, DEFAULT_CURRENCY);
    }

    /**
     * Creates Money with the specified amount and currency.
     *
     * @param amount   the monetary amount
     * @param currency the currency code
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money of(BigDecimal amount, String currency) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return new Money(amount, currency);
    }

    public static Money of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static Money zero() {
        return new Money(BigDecimal.ZERO, DEFAULT_CURRENCY);
    }

    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    /**
     * Adds another Money to this one.
     *
     * @throws IllegalArgumentException if currencies don't match
     */
    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(this.amount.add(other.amount), this.currency);
    }

    /**
     * Subtracts another Money from this one.
     *
     * @throws IllegalArgumentException if currencies don't match or the result would be negative
     */
    public Money subtract(Money other) {
        requireSameCurrency(other);
        return of(this.amount.subtract(other.amount), this.currency);
    }

    /**
     * Multiplies this Money by a quantity.
     *
     * @throws IllegalArgumentException if quantity is negative
     */
    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)), this.currency);
    }

    public boolean isLessThan(BigDecimal threshold) {
        return amount.compareTo(threshold) < 0;
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "Money cannot be null");
        if (!this.currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                    "Currency mismatch: " + this.currency + " vs " + other.currency);
        }
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0 && Objects.equals(currency, money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
