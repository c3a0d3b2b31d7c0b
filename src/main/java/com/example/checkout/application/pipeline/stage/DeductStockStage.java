package com.example.checkout.application.pipeline.stage;

import com.example.checkout.application.pipeline.CheckoutStage;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.pipeline.CreatedOrder;
import com.example.checkout.application.pipeline.StockDeducted;
import com.example.checkout.application.pipeline.StockMovement;
import com.example.checkout.application.port.out.AuditPort;
import com.example.checkout.application.port.out.AuditPort.AuditEntry;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.port.out.StockLedgerPort;
import com.example.checkout.application.port.out.StockLedgerPort.StockChange;
import com.example.checkout.application.service.OrderRecorder;
import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderItem;
import com.example.checkout.domain.model.OrderStatus;
import com.example.checkout.domain.model.StatusField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Takes every item of the order out of the ledger and confirms the order.
 * <p>
 * All lines share one transaction: an insufficient-stock failure on any line rolls back the
 * deductions already applied. Units are locked in a fixed order so two checkouts touching the
 * same units cannot deadlock.
 */
@Component
public class DeductStockStage implements CheckoutStage<CreatedOrder, StockDeducted> {

    private static final Logger log = LoggerFactory.getLogger(DeductStockStage.class);

    private final OrderStorePort orderStore;
    private final StockLedgerPort stockLedger;
    private final AuditPort auditPort;
    private final OrderRecorder orderRecorder;
    private final Clock clock;

    public DeductStockStage(
            OrderStorePort orderStore,
            StockLedgerPort stockLedger,
            AuditPort auditPort,
            OrderRecorder orderRecorder,
            Clock clock) {
        this.orderStore = orderStore;
        this.stockLedger = stockLedger;
        this.auditPort = auditPort;
        this.orderRecorder = orderRecorder;
        this.clock = clock;
    }

    @Override
    public CheckoutStep step() {
        return CheckoutStep.DEDUCT_STOCK;
    }

    @Override
    public Class<CreatedOrder> inputType() {
        return CreatedOrder.class;
    }

    @Override
    @Transactional
    public StockDeducted execute(CreatedOrder input) {
        OrderId orderId = OrderId.of(input.orderId());
        Order order = orderStore.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(input.orderId()));

        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new InvalidTransitionException(orderId, StatusField.STATUS,
                    order.getStatus().wireValue(), OrderStatus.CONFIRMED.wireValue());
        }
        if (order.getStatus().holdsStock()) {
            log.info("Stock for order {} already deducted, skipping", order.getOrderNumber());
            return StockDeducted.alreadyApplied(input);
        }

        Actor actor = Actor.system();
        List<OrderItem> items = new ArrayList<>(order.getItems());
        items.sort(Comparator.comparing(OrderItem::stockUnit));

        List<StockMovement> movements = new ArrayList<>(items.size());
        for (OrderItem item : items) {
            StockChange change = stockLedger.reduce(item.stockUnit(), item.getQuantity());
            // untracked products come back unchanged
            if (change.delta() != 0) {
                auditPort.record(AuditEntry.stockChange(change, actor, "order_created", Map.of(
                        "order_id", input.orderId(),
                        "quantity_deducted", item.getQuantity())));
            }
            movements.add(new StockMovement(change.unit().type(), change.unit().id(),
                    change.oldQuantity(), change.newQuantity()));
        }

        order.confirm(actor, clock.instant());
        orderRecorder.persist(order, actor);

        log.info("Stock deducted for order {}: {} unit(s) updated", order.getOrderNumber(), movements.size());
        return new StockDeducted(input.checkoutId(), input.userId(), input.cartId(),
                input.orderId(), input.orderNumber(), movements);
    }
}
