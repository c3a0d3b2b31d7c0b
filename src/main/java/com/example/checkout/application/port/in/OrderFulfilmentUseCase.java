package com.example.checkout.application.port.in;

import com.example.checkout.application.dto.OrderView;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.PaymentStatus;

/**
 * Inbound port for back-office transitions driven by shipping and payment collaborators.
 */
public interface OrderFulfilmentUseCase {

    OrderView ship(OrderId orderId, String trackingNumber, Actor actor);

    OrderView deliver(OrderId orderId, Actor actor);

    OrderView updatePaymentStatus(OrderId orderId, PaymentStatus paymentStatus, Actor actor);
}
