package com.example.checkout.domain.model;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Who is performing a mutation. Passed explicitly to every state change so that
 * history and audit rows can be attributed without ambient request state.
 */
public final class Actor {

    private static final Actor SYSTEM = new Actor(null);

    private final UUID userId;

    private Actor(UUID userId) {
        this.userId = userId;
    }

    public static Actor system() {
        return SYSTEM;
    }

    public static Actor user(UUID userId) {
        return new Actor(Objects.requireNonNull(userId, "User id cannot be null"));
    }

    public Optional<UUID> userId() {
        return Optional.ofNullable(userId);
    }

    public boolean isSystem() {
        return userId == null;
    }

    /**
     * Identifier written to history rows; {@code null} for system-driven changes.
     */
    public String auditId() {
        return userId != null ? userId.toString() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(userId, ((Actor) o).userId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(userId);
    }

    @Override
    public String toString() {
        return isSystem() ? "system" : "user:" + userId;
    }
}
