package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Postal address copied onto an order at checkout time.
 * Orders keep their own copy so later edits to a customer's address book do not rewrite history.
 */
public record Address(
        String firstName,
        String lastName,
        String line1,
        String line2,
        String city,
        String state,
        String postalCode,
        String country,
        String phone
) {
    public Address {
        Objects.requireNonNull(firstName, "First name cannot be null");
        Objects.requireNonNull(lastName, "Last name cannot be null");
        Objects.requireNonNull(line1, "Address line 1 cannot be null");
        Objects.requireNonNull(city, "City cannot be null");
        Objects.requireNonNull(postalCode, "Postal code cannot be null");
        Objects.requireNonNull(country, "Country cannot be null");
    }

    public String fullName() {
        return firstName + " " + lastName;
    }

    /**
     * Single-line rendering used in confirmations and logs.
     */
    public String format() {
        StringJoiner joiner = new StringJoiner(", ");
        joiner.add(line1);
        if (line2 != null && !line2.isBlank()) {
            joiner.add(line2);
        }
        joiner.add(city);
        if (state != null && !state.isBlank()) {
            joiner.add(state + " " + postalCode);
        } else {
            joiner.add(postalCode);
        }
        joiner.add(country);
        return joiner.toString();
    }
}
