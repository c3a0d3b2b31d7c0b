package com.example.checkout.application.pipeline;

import java.util.List;
import java.util.UUID;

/**
 * Output of the deduct-stock stage. {@code movements} is empty when a re-run found the stock already deducted.
 */
public record StockDeducted(
        UUID checkoutId,
        UUID userId,
        UUID cartId,
        String orderId,
        String orderNumber,
        List<StockMovement> movements
) implements CheckoutPayload {

    public StockDeducted {
        movements = List.copyOf(movements);
    }

    public static StockDeducted alreadyApplied(CreatedOrder input) {
        return new StockDeducted(input.checkoutId(), input.userId(), input.cartId(),
                input.orderId(), input.orderNumber(), List.of());
    }
}
