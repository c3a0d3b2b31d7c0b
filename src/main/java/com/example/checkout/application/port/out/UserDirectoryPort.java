package com.example.checkout.application.port.out;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the accounts service.
 */
public interface UserDirectoryPort {

    /**
     * Looks up a customer by id. Completes with an empty Optional when the account does not exist.
     */
    CompletableFuture<Optional<Customer>> byId(UUID userId);

    record Customer(UUID id, String email, String firstName, String lastName, boolean active) {

        public String fullName() {
            return firstName + " " + lastName;
        }
    }
}
