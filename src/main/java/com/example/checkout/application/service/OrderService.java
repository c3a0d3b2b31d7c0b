package com.example.checkout.application.service;

import com.example.checkout.application.dto.OrderSummary;
import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.port.in.CancelOrderUseCase;
import com.example.checkout.application.port.in.OrderFulfilmentUseCase;
import com.example.checkout.application.port.in.OrderQueryUseCase;
import com.example.checkout.application.port.out.AuditPort;
import com.example.checkout.application.port.out.AuditPort.AuditEntry;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.application.port.out.StockLedgerPort;
import com.example.checkout.application.port.out.StockLedgerPort.StockChange;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderItem;
import com.example.checkout.domain.model.PaymentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Order queries and post-checkout transitions. Every transition locks the order row first,
 * so concurrent cancel and ship requests on one order are serialized.
 */
@Service
public class OrderService implements CancelOrderUseCase, OrderQueryUseCase, OrderFulfilmentUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderStorePort orderStore;
    private final StockLedgerPort stockLedger;
    private final AuditPort auditPort;
    private final OrderRecorder orderRecorder;
    private final Clock clock;

    public OrderService(
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
    @Transactional
    public OrderView cancel(OrderId orderId, Actor actor) {
        Order order = orderStore.findByIdForUpdate(orderId)
                .filter(o -> actor.userId().map(o::isOwnedBy).orElse(false))
                .orElseThrow(() -> new OrderNotFoundException(orderId.getValue()));

        List<OrderItem> restock = order.cancel(actor, clock.instant());

        restock.stream()
                .sorted(Comparator.comparing(OrderItem::stockUnit))
                .forEach(item -> {
                    StockChange change = stockLedger.increase(item.stockUnit(), item.getQuantity());
                    if (change.delta() != 0) {
                        auditPort.record(AuditEntry.stockChange(change, actor, "order_cancelled",
                                Map.of("order_id", orderId.getValue())));
                    }
                });

        orderRecorder.persist(order, actor);
        log.info("Order {} cancelled by {}, {} item(s) restocked", order.getOrderNumber(), actor, restock.size());
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView ship(OrderId orderId, String trackingNumber, Actor actor) {
        Order order = lockOrder(orderId);
        order.ship(trackingNumber, actor, clock.instant());
        orderRecorder.persist(order, actor);
        log.info("Order {} shipped with tracking {}", order.getOrderNumber(), trackingNumber);
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView deliver(OrderId orderId, Actor actor) {
        Order order = lockOrder(orderId);
        order.deliver(actor, clock.instant());
        orderRecorder.persist(order, actor);
        log.info("Order {} delivered", order.getOrderNumber());
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView updatePaymentStatus(OrderId orderId, PaymentStatus paymentStatus, Actor actor) {
        Order order = lockOrder(orderId);
        PaymentStatus previous = order.getPaymentStatus();
        order.updatePaymentStatus(paymentStatus, actor, clock.instant());
        orderRecorder.persist(order, actor);
        log.info("Order {} payment status {} -> {}", order.getOrderNumber(),
                previous.wireValue(), paymentStatus.wireValue());
        return OrderView.from(order);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OrderView> findOwnedOrder(OrderId orderId, UUID userId) {
        return orderStore.findById(orderId)
                .filter(order -> order.isOwnedBy(userId))
                .map(OrderView::from);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderSummary> recentOrders(UUID userId, int limit) {
        return orderStore.findRecentByUser(userId, limit).stream()
                .map(OrderSummary::from)
                .toList();
    }

    private Order lockOrder(OrderId orderId) {
        return orderStore.findByIdForUpdate(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId.getValue()));
    }
}
