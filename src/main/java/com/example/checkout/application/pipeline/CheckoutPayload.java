package com.example.checkout.application.pipeline;

import java.util.UUID;

/**
 * Serialized input or output of a pipeline stage. Stages communicate only through these values.
 */
public interface CheckoutPayload {

    UUID checkoutId();

    UUID userId();

    /**
     * The order produced by the pipeline, once it exists.
     */
    default String orderId() {
        return null;
    }
}
