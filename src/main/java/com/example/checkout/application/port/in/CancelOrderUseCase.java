package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.OrderId;

/**
 * Inbound port for customer cancellation.
 */
public interface CancelOrderUseCase {

    /**
     * Cancels the order and returns its stock to the ledger.
     *
     * @throws com.example.checkout.domain.exception.OrderNotFoundException if no such order belongs to the actor
     * @throws com.example.checkout.domain.exception.InvalidTransitionException if the order can no longer be cancelled
     */
    OrderView cancel(OrderId orderId, Actor actor);
}
