package com.example.checkout.application.pipeline;

/**
 * One idempotent step of the checkout pipeline.
 * <p>
 * A stage may be executed more than once for the same input (retry, or a worker crash after
 * the stage committed). Running it again must not repeat its side effects.
 *
 * @param <I> input produced by the previous stage
 * @param <O> output handed to the next stage
 */
public interface CheckoutStage<I extends CheckoutPayload, O extends CheckoutPayload> {

    CheckoutStep step();

    Class<I> inputType();

    O execute(I input);
}
