package com.example.checkout.application.port.out;

import com.example.checkout.domain.model.CartSnapshot;

import java.util.Optional;
import java.util.UUID;

/**
 * Outbound port for the cart store.
 */
public interface CartPort {

    /**
     * Takes a snapshot of the user's current cart lines. The cart row stays locked until the
     * caller's transaction ends, so submissions for one cart are serialized.
     */
    Optional<CartSnapshot> snapshotLines(UUID userId);

    /**
     * Locks the cart row for the rest of the transaction and returns its current lines.
     */
    Optional<CartSnapshot> lockForCheckout(UUID cartId);

    /**
     * Deletes all lines of the cart.
     */
    void clear(UUID cartId);
}
