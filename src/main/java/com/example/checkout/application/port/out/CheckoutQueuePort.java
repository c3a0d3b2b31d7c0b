package com.example.checkout.application.port.out;

import com.example.checkout.application.pipeline.CheckoutPayload;
import com.example.checkout.application.pipeline.CheckoutStep;

/**
 * Outbound port for handing a pipeline step to the durable task queue.
 */
public interface CheckoutQueuePort {

    /**
     * Enqueues {@code step} with its serialized input in the caller's transaction.
     */
    void enqueue(CheckoutStep step, CheckoutPayload input);
}
