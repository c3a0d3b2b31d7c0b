package com.example.checkout.domain.exception;

import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.StatusField;

/**
 * Illegal move on one of the order state machines. The order is left unchanged.
 */
public class InvalidTransitionException extends DomainException {

    private final OrderId orderId;
    private final StatusField field;
    private final String currentValue;
    private final String requestedValue;

    public InvalidTransitionException(OrderId orderId, StatusField field, String currentValue, String requestedValue) {
        super("INVALID_TRANSITION", String.format("Order %s cannot move %s from %s to %s",
                orderId, field.column(), currentValue, requestedValue));
        this.orderId = orderId;
        this.field = field;
        this.currentValue = currentValue;
        this.requestedValue = requestedValue;
    }

    public OrderId getOrderId() {
        return orderId;
    }

    public StatusField getField() {
        return field;
    }

    public String getCurrentValue() {
        return currentValue;
    }

    public String getRequestedValue() {
        return requestedValue;
    }
}
