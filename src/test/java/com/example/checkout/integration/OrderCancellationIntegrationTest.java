package com.example.checkout.integration;

import com.example.checkout.application.dto.CheckoutReceipt;
import com.example.checkout.application.dto.OrderView;
import com.example.checkout.application.dto.SubmitCheckoutCommand;
import com.example.checkout.application.port.in.CancelOrderUseCase;
import com.example.checkout.application.port.in.OrderFulfilmentUseCase;
import com.example.checkout.application.port.in.SubmitCheckoutUseCase;
import com.example.checkout.application.port.out.CheckoutAttemptPort;
import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.OrderNotFoundException;
import com.example.checkout.domain.model.Actor;
import com.example.checkout.domain.model.CheckoutStatus;
import com.example.checkout.domain.model.Order;
import com.example.checkout.domain.model.OrderId;
import com.example.checkout.domain.model.OrderStatus;
import com.example.checkout.domain.model.PaymentStatus;
import com.example.checkout.infrastructure.persistence.entity.AuditLogEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.repository.AuditLogJpaRepository;
import com.example.checkout.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for customer cancellation and the stock it returns.
 */
@ActiveProfiles("test")
@DisplayName("Order Cancellation Integration Tests")
class OrderCancellationIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private SubmitCheckoutUseCase checkoutUseCase;

    @Autowired
    private CancelOrderUseCase cancelOrderUseCase;

    @Autowired
    private OrderFulfilmentUseCase fulfilmentUseCase;

    @Autowired
    private CheckoutAttemptPort attemptPort;

    @Autowired
    private OrderStorePort orderStore;

    @Autowired
    private AuditLogJpaRepository auditLogRepository;

    private Order checkedOutOrder(UUID userId, ProductEntity product, int quantity) {
        givenCart(userId, line(product, quantity));
        stubAccount(userId, true);
        CheckoutReceipt receipt = submit(userId);
        drainPipeline();
        return orderStore.findByCheckoutId(receipt.checkoutId()).orElseThrow();
    }

    private CheckoutReceipt submit(UUID userId) {
        return checkoutUseCase.submit(new SubmitCheckoutCommand(userId, UUID.randomUUID().toString(),
                SHIPPING_ADDRESS, null, null));
    }

    private void dispatchOnce() {
        dispatcher.dispatchDue(Instant.now().plus(Duration.ofDays(1)), Runnable::run);
    }

    @Test
    @DisplayName("should_restock_items_when_confirmed_order_cancelled - 取消已確認訂單時回補庫存")
    void should_restock_items_when_confirmed_order_cancelled() {
        // Given: a confirmed order for 2 of 5
        UUID userId = UUID.randomUUID();
        ProductEntity product = givenProduct("Backpack", "45.00", 5);
        Order order = checkedOutOrder(userId, product, 2);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(stockOf(product)).isEqualTo(3);

        // When
        OrderView cancelled = cancelOrderUseCase.cancel(order.getId(), Actor.user(userId));

        // Then
        assertThat(cancelled.status()).isEqualTo("cancelled");
        assertThat(cancelled.cancellable()).isFalse();
        assertThat(stockOf(product)).isEqualTo(5);

        List<AuditLogEntity> audit = auditLogRepository.findByModelNameAndObjectIdOrderByIdAsc(
                "Product", product.getId().toString());
        assertThat(audit).hasSize(2);
        assertThat(audit.get(1).getOldValue()).isEqualTo("3");
        assertThat(audit.get(1).getNewValue()).isEqualTo("5");
        assertThat(audit.get(1).getActorId()).isEqualTo(userId.toString());

        Order reloaded = orderStore.findById(order.getId()).orElseThrow();
        assertThat(reloaded.getStatusHistory())
                .extracting(change -> change.to())
                .containsExactly("confirmed", "cancelled");
    }

    @Test
    @DisplayName("should_skip_stock_audit_for_untracked_product_on_cancel - 取消不追蹤庫存商品的訂單時不寫庫存稽核")
    void should_skip_stock_audit_for_untracked_product_on_cancel() {
        UUID userId = UUID.randomUUID();
        ProductEntity product = givenProduct("Gift Card", "50.00", 0);
        product.setTrackInventory(false);
        productRepository.save(product);
        Order order = checkedOutOrder(userId, product, 2);

        OrderView cancelled = cancelOrderUseCase.cancel(order.getId(), Actor.user(userId));

        assertThat(cancelled.status()).isEqualTo("cancelled");
        assertThat(stockOf(product)).isZero();
        assertThat(auditLogRepository.findByModelNameAndObjectIdOrderByIdAsc(
                "Product", product.getId().toString())).isEmpty();
    }

    @Test
    @DisplayName("should_hide_order_from_other_users - 其他使用者無法取消訂單")
    void should_hide_order_from_other_users() {
        UUID userId = UUID.randomUUID();
        ProductEntity product = givenProduct("Umbrella", "15.00", 5);
        Order order = checkedOutOrder(userId, product, 1);

        assertThatThrownBy(() -> cancelOrderUseCase.cancel(order.getId(), Actor.user(UUID.randomUUID())))
                .isInstanceOf(OrderNotFoundException.class);
        assertThat(stockOf(product)).isEqualTo(4);
    }

    @Test
    @DisplayName("should_reject_cancelling_shipped_order - 已出貨訂單無法取消")
    void should_reject_cancelling_shipped_order() {
        // Given
        UUID userId = UUID.randomUUID();
        ProductEntity product = givenProduct("Bicycle", "300.00", 2);
        Order order = checkedOutOrder(userId, product, 1);
        fulfilmentUseCase.ship(order.getId(), "TRK-777", Actor.system());

        // When & Then
        assertThatThrownBy(() -> cancelOrderUseCase.cancel(order.getId(), Actor.user(userId)))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(stockOf(product)).isEqualTo(1);
        assertThat(orderStore.findById(order.getId()).orElseThrow().getStatus()).isEqualTo(OrderStatus.SHIPPED);
    }

    @Test
    @DisplayName("should_not_deduct_stock_for_order_cancelled_before_deduction - 扣庫存前取消的訂單不再扣減")
    void should_not_deduct_stock_for_order_cancelled_before_deduction() {
        // Given: validate and create-order have run, deduct-stock is still queued
        UUID userId = UUID.randomUUID();
        ProductEntity product = givenProduct("Helmet", "60.00", 4);
        givenCart(userId, line(product, 2));
        stubAccount(userId, true);
        CheckoutReceipt receipt = submit(userId);
        dispatchOnce();
        dispatchOnce();
        Order pending = orderStore.findByCheckoutId(receipt.checkoutId()).orElseThrow();
        assertThat(pending.getStatus()).isEqualTo(OrderStatus.PENDING);

        // When: the customer cancels, then the pipeline continues
        OrderView cancelled = cancelOrderUseCase.cancel(pending.getId(), Actor.user(userId));
        drainPipeline();

        // Then: nothing was taken from or returned to the ledger
        assertThat(cancelled.status()).isEqualTo("cancelled");
        assertThat(stockOf(product)).isEqualTo(4);
        assertThat(attemptPort.findById(receipt.checkoutId()).orElseThrow().status())
                .isEqualTo(CheckoutStatus.FAILED);
        assertThat(auditLogRepository.findByModelNameAndObjectIdOrderByIdAsc(
                "Product", product.getId().toString())).isEmpty();
    }

    @Test
    @DisplayName("should_walk_order_through_fulfilment - 訂單出貨、送達與付款狀態")
    void should_walk_order_through_fulfilment() {
        UUID userId = UUID.randomUUID();
        ProductEntity product = givenProduct("Lamp Shade", "18.00", 3);
        Order order = checkedOutOrder(userId, product, 1);
        OrderId orderId = order.getId();

        fulfilmentUseCase.updatePaymentStatus(orderId, PaymentStatus.PAID,
                Actor.system());
        fulfilmentUseCase.ship(orderId, "TRK-100", Actor.system());
        OrderView delivered = fulfilmentUseCase.deliver(orderId, Actor.system());

        assertThat(delivered.status()).isEqualTo("delivered");
        assertThat(delivered.paymentStatus()).isEqualTo("paid");
        assertThat(delivered.trackingNumber()).isEqualTo("TRK-100");
        assertThat(delivered.deliveredAt()).isNotNull();
    }
}
