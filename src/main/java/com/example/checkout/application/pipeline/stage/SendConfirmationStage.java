package com.example.checkout.application.pipeline.stage;

import com.example.checkout.application.pipeline.CheckoutCompleted;
import com.example.checkout.application.pipeline.CheckoutStage;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.pipeline.StockDeducted;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.service.OrderRecorder;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderEventType;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Map;

/**
 * Terminal stage: logs the order confirmation in place of an e-mail and empties the cart.
 */
@Component
public class SendConfirmationStage implements CheckoutStage<StockDeducted, CheckoutCompleted> {

    private static final Logger log = LoggerFactory.getLogger(SendConfirmationStage.class);

    private final OrderStorePort orderStore;
    private final CartPort cartPort;
    private final OrderRecorder orderRecorder;
    private final Clock clock;

    public SendConfirmationStage(OrderStorePort orderStore, CartPort cartPort,
                                 OrderRecorder orderRecorder, Clock clock) {
        this.orderStore = orderStore;
        this.cartPort = cartPort;
        this.orderRecorder = orderRecorder;
        this.clock = clock;
    }

    @Override
    public CheckoutStep step() {
        return CheckoutStep.SEND_CONFIRMATION;
    }

    @Override
    public Class<StockDeducted> inputType() {
        return StockDeducted.class;
    }

    @Override
    @Transactional
    public CheckoutCompleted execute(StockDeducted input) {
        Order order = orderStore.findByIdForUpdate(OrderId.of(input.orderId()))
                .orElseThrow(() -> new OrderNotFoundException(input.orderId()));

        if (order.hasEvent(OrderEventType.CONFIRMATION_SENT)) {
            log.info("Confirmation for order {} already sent, skipping", order.getOrderNumber());
            return new CheckoutCompleted(input.checkoutId(), input.userId(), input.orderId(),
                    input.orderNumber(), clock.instant());
        }

        log.info("Order confirmation\n{}", formatConfirmation(order));

        cartPort.clear(input.cartId());
        order.recordEvent(OrderEventType.CONFIRMATION_SENT, "Order confirmation sent",
                Map.of("cart_id", input.cartId().toString()), clock.instant());
        orderRecorder.persist(order, Actor.system());

        return new CheckoutCompleted(input.checkoutId(), input.userId(), input.orderId(),
                input.orderNumber(), clock.instant());
    }

    static String formatConfirmation(Order order) {
        StringBuilder body = new StringBuilder()
                .append("Order Number: ").append(order.getOrderNumber()).append('\n')
                .append("Customer: ").append(order.getShippingAddress().fullName()).append('\n')
                .append("Items:\n");
        for (OrderItem item : order.getItems()) {
            body.append("  - ").append(item.displayName())
                    .append(" x").append(item.getQuantity())
                    .append(" @ ").append(item.getUnitPrice())
                    .append(" = ").append(item.getTotalPrice()).append('\n');
        }
        body.append("Total: ").append(order.getTotal()).append('\n')
                .append("Ship to: ").append(order.getShippingAddress().format());
        return body.toString();
    }
}
