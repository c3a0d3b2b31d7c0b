package com.example.checkout.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Value Object for the human-readable order number, e.g. {@code ORD-482913517}.
 * <p>
 * Six digits taken from the epoch-second clock followed by a three digit random suffix.
 * Uniqueness is probabilistic; the persistence layer backs it with a unique constraint.
 */
public final class OrderNumber {

    private static final String PREFIX = "ORD-";
    private static final Pattern FORMAT = Pattern.compile("^ORD-\\d{6}\\d{3}$");

    private final String value;

    private OrderNumber(String value) {
        this.value = value;
    }

    /**
     * Parses an existing order number.
     *
     * @throws IllegalArgumentException if the value does not match {@code ORD-\d{9}}
     */
    public static OrderNumber of(String value) {
        Objects.requireNonNull(value, "Order number cannot be null");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid order number format: " + value);
        }
        return new OrderNumber(value);
    }

    /**
     * Generates a new order number from the given instant and random source.
     */
    public static OrderNumber generate(Instant now, Random random) {
        long timestampPart = now.getEpochSecond() % 1_000_000L;
        int randomPart = 100 + random.nextInt(900);
        return new OrderNumber(PREFIX + String.format("%06d%03d", timestampPart, randomPart));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((OrderNumber) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
