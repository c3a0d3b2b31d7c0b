package com.example.checkout.unit.domain;

import com.example.checkout.domain.exception.InvalidTransitionException;
import com.example.checkout.domain.exception.ValidationException;
import com.example.checkout.domain.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Order aggregate.
 */
@DisplayName("Order Domain Tests")
class OrderTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final UUID USER_ID = UUID.randomUUID();
    private static final Address ADDRESS = new Address("Mei", "Lin", "100 Songren Rd", null,
            "Taipei", null, "110", "TW", null);

    private static OrderItem item(String sku, int quantity, String unitPrice) {
        return OrderItem.snapshot(UUID.randomUUID(), null, "Product " + sku, null, sku, quantity,
                Money.of(new BigDecimal(unitPrice)));
    }

    private static Order pendingOrder(OrderItem... items) {
        return Order.place(OrderId.generate(), OrderNumber.generate(NOW, new Random(7)),
                USER_ID, UUID.randomUUID(), List.of(items), OrderCharges.none(Money.DEFAULT_CURRENCY),
                ADDRESS, ADDRESS, null, NOW);
    }

    @Nested
    @DisplayName("Order Placement")
    class OrderPlacement {

        @Test
        @DisplayName("should_place_pending_order_with_created_event - 新訂單為待處理並記錄建立事件")
        void should_place_pending_order_with_created_event() {
            // When
            Order order = pendingOrder(item("SKU001", 2, "15.00"));

            // Then
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.isNew()).isTrue();
            assertThat(order.hasEvent(OrderEventType.CREATED)).isTrue();
            assertThat(order.getNewEvents()).hasSize(1);
            assertThat(order.getStatusHistory()).isEmpty();
        }

        @Test
        @DisplayName("should_compute_subtotal_and_total_from_item_snapshots - 依品項快照計算金額")
        void should_compute_subtotal_and_total_from_item_snapshots() {
            // Given: 2 x 15.00 + 3 x 5.00
            Order order = pendingOrder(item("SKU001", 2, "15.00"), item("SKU002", 3, "5.00"));

            // Then
            assertThat(order.getSubtotal()).isEqualTo(Money.of("45.00"));
            assertThat(order.getTotal()).isEqualTo(Money.of("45.00"));
            assertThat(order.getTax()).isEqualTo(Money.zero());
        }

        @Test
        @DisplayName("should_apply_charges_and_discount - 套用稅金、運費與折扣")
        void should_apply_charges_and_discount() {
            // Given
            OrderCharges charges = new OrderCharges(Money.of("2.00"), Money.of("5.00"), Money.of("4.00"));

            // When
            Order order = Order.place(OrderId.generate(), OrderNumber.of("ORD-123456789"), USER_ID,
                    UUID.randomUUID(), List.of(item("SKU001", 1, "10.00")), charges, ADDRESS, ADDRESS, "gift", NOW);

            // Then: 10 + 2 + 5 - 4
            assertThat(order.getTotal()).isEqualTo(Money.of("13.00"));
            assertThat(order.getNotes()).isEqualTo("gift");
        }

        @Test
        @DisplayName("should_reject_order_without_items - 拒絕無品項訂單")
        void should_reject_order_without_items() {
            assertThatThrownBy(() -> Order.place(OrderId.generate(), OrderNumber.of("ORD-123456789"), USER_ID,
                    UUID.randomUUID(), List.of(), OrderCharges.none("USD"), ADDRESS, ADDRESS, null, NOW))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("should_reject_total_below_minimum - 總額低於 0.01 時拒絕")
        void should_reject_total_below_minimum() {
            assertThatThrownBy(() -> pendingOrder(item("FREE", 1, "0.00")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("at least 0.01");
        }

        @Test
        @DisplayName("should_reject_discount_larger_than_gross - 折扣超過金額時拒絕")
        void should_reject_discount_larger_than_gross() {
            OrderCharges charges = new OrderCharges(Money.zero(), Money.zero(), Money.of("50.00"));

            assertThatThrownBy(() -> Order.place(OrderId.generate(), OrderNumber.of("ORD-123456789"), USER_ID,
                    UUID.randomUUID(), List.of(item("SKU001", 1, "10.00")), charges, ADDRESS, ADDRESS, null, NOW))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Status Transitions")
    class StatusTransitions {

        @Test
        @DisplayName("should_walk_happy_path_to_delivered - 正常流程直到送達")
        void should_walk_happy_path_to_delivered() {
            // Given
            Order order = pendingOrder(item("SKU001", 1, "10.00"));
            Actor admin = Actor.user(UUID.randomUUID());

            // When
            order.confirm(Actor.system(), NOW);
            order.ship("TRK-1", admin, NOW.plusSeconds(60));
            order.deliver(admin, NOW.plusSeconds(120));

            // Then
            assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERED);
            assertThat(order.getTrackingNumber()).isEqualTo("TRK-1");
            assertThat(order.getShippedAt()).isEqualTo(NOW.plusSeconds(60));
            assertThat(order.getDeliveredAt()).isEqualTo(NOW.plusSeconds(120));
            assertThat(order.getStatusHistory())
                    .extracting(StatusChange::to)
                    .containsExactly("confirmed", "shipped", "delivered");
            assertThat(order.getStatusHistory().get(0).changedBy()).isNull();
            assertThat(order.getStatusHistory().get(1).changedBy()).isEqualTo(admin.auditId());
        }

        @Test
        @DisplayName("should_reject_shipping_pending_order - 待處理訂單不可出貨")
        void should_reject_shipping_pending_order() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));

            assertThatThrownBy(() -> order.ship("TRK-1", Actor.system(), NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .hasMessageContaining("pending")
                    .hasMessageContaining("shipped");
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getStatusHistory()).isEmpty();
        }

        @Test
        @DisplayName("should_require_tracking_number_to_ship - 出貨需要追蹤號碼")
        void should_require_tracking_number_to_ship() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));
            order.confirm(Actor.system(), NOW);

            assertThatThrownBy(() -> order.ship(" ", Actor.system(), NOW))
                    .isInstanceOf(ValidationException.class);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CONFIRMED);
        }

        @Test
        @DisplayName("should_not_leave_delivered_except_to_refunded - 已送達只能退款")
        void should_not_leave_delivered_except_to_refunded() {
            assertThat(OrderStatus.DELIVERED.allowedTargets()).containsExactly(OrderStatus.REFUNDED);
            assertThat(OrderStatus.CANCELLED.allowedTargets()).isEmpty();
            assertThat(OrderStatus.REFUNDED.allowedTargets()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("should_return_no_items_when_cancelling_pending_order - 待處理訂單取消不需回補庫存")
        void should_return_no_items_when_cancelling_pending_order() {
            Order order = pendingOrder(item("SKU001", 2, "10.00"));

            List<OrderItem> restock = order.cancel(Actor.user(USER_ID), NOW);

            assertThat(restock).isEmpty();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(order.hasEvent(OrderEventType.CANCELLED)).isTrue();
        }

        @Test
        @DisplayName("should_return_items_when_cancelling_confirmed_order - 已確認訂單取消需回補庫存")
        void should_return_items_when_cancelling_confirmed_order() {
            Order order = pendingOrder(item("SKU001", 2, "10.00"), item("SKU002", 1, "3.00"));
            order.confirm(Actor.system(), NOW);

            List<OrderItem> restock = order.cancel(Actor.user(USER_ID), NOW);

            assertThat(restock).hasSize(2);
            assertThat(restock).extracting(OrderItem::getQuantity).containsExactly(2, 1);
        }

        @Test
        @DisplayName("should_reject_cancelling_shipped_order - 已出貨訂單不可取消")
        void should_reject_cancelling_shipped_order() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));
            order.confirm(Actor.system(), NOW);
            order.ship("TRK-9", Actor.system(), NOW);

            assertThat(order.canBeCancelled()).isFalse();
            assertThatThrownBy(() -> order.cancel(Actor.user(USER_ID), NOW))
                    .isInstanceOf(InvalidTransitionException.class);
        }

        @Test
        @DisplayName("should_reject_second_cancel - 重複取消會被拒絕")
        void should_reject_second_cancel() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));
            order.cancel(Actor.user(USER_ID), NOW);

            assertThatThrownBy(() -> order.cancel(Actor.user(USER_ID), NOW))
                    .isInstanceOf(InvalidTransitionException.class);
        }
    }

    @Nested
    @DisplayName("Payment Status")
    class PaymentStatusTransitions {

        @Test
        @DisplayName("should_record_payment_received_event - 付款成功記錄事件")
        void should_record_payment_received_event() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));

            order.updatePaymentStatus(PaymentStatus.PAID, Actor.system(), NOW);

            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
            assertThat(order.hasEvent(OrderEventType.PAYMENT_RECEIVED)).isTrue();
            assertThat(order.getStatusHistory()).singleElement()
                    .satisfies(change -> {
                        assertThat(change.field()).isEqualTo(StatusField.PAYMENT_STATUS);
                        assertThat(change.from()).isEqualTo("pending");
                        assertThat(change.to()).isEqualTo("paid");
                    });
            // Payment does not move the fulfilment status
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("should_allow_retry_after_failed_payment - 付款失敗後可重新處理")
        void should_allow_retry_after_failed_payment() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));
            order.updatePaymentStatus(PaymentStatus.FAILED, Actor.system(), NOW);

            order.updatePaymentStatus(PaymentStatus.PROCESSING, Actor.system(), NOW);

            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PROCESSING);
            assertThat(order.hasEvent(OrderEventType.PAYMENT_FAILED)).isTrue();
        }

        @Test
        @DisplayName("should_reject_refund_of_unpaid_order - 未付款訂單不可退款")
        void should_reject_refund_of_unpaid_order() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));

            assertThatThrownBy(() -> order.updatePaymentStatus(PaymentStatus.REFUNDED, Actor.system(), NOW))
                    .isInstanceOf(InvalidTransitionException.class)
                    .satisfies(e -> assertThat(((InvalidTransitionException) e).getField())
                            .isEqualTo(StatusField.PAYMENT_STATUS));
        }
    }

    @Nested
    @DisplayName("Change Buffers")
    class ChangeBuffers {

        @Test
        @DisplayName("should_clear_new_changes_after_persist - 儲存後清空待寫入變更")
        void should_clear_new_changes_after_persist() {
            Order order = pendingOrder(item("SKU001", 1, "10.00"));
            order.confirm(Actor.system(), NOW);

            order.markPersisted(3L);

            assertThat(order.isNew()).isFalse();
            assertThat(order.getVersion()).isEqualTo(3L);
            assertThat(order.getNewEvents()).isEmpty();
            assertThat(order.getNewStatusChanges()).isEmpty();
            assertThat(order.getStatusHistory()).hasSize(1);
            assertThat(order.getEvents()).hasSize(2);
        }
    }
}
