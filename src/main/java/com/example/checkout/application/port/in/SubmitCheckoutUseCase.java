package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.CheckoutReceipt;
import com.example.checkout.application.dto.SubmitCheckoutCommand;

import java.util.UUID;

/**
 * Inbound port for starting and tracking checkouts.
 */
public interface SubmitCheckoutUseCase {

    /**
     * Snapshots the user's cart and enqueues the pipeline. Returns as soon as the work is queued.
     *
     * @throws com.example.checkout.domain.exception.CheckoutRejectedException if the cart is missing, empty,
     *         or already being checked out
     */
    CheckoutReceipt submit(SubmitCheckoutCommand command);

    /**
     * @throws com.example.checkout.domain.exception.CheckoutNotFoundException if the checkout does not
     *         exist or belongs to another user
     */
    CheckoutReceipt status(UUID checkoutId, UUID userId);
}
