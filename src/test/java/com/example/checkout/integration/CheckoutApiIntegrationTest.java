package com.example.checkout.integration;

import com.example.checkout.infrastructure.adapter.in.web.dto.CheckoutResponse;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductVariantEntity;
import com.example.checkout.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * HTTP-level tests for the checkout, order and admin endpoints.
 */
@ActiveProfiles("test")
@DisplayName("Checkout API Integration Tests")
class CheckoutApiIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private WebTestClient webTestClient;

    private static final String CHECKOUT_REQUEST = """
            {
                "shippingAddress": {
                    "firstName": "Mei",
                    "lastName": "Lin",
                    "line1": "100 Songren Rd",
                    "city": "Taipei",
                    "postalCode": "110",
                    "country": "TW"
                },
                "notes": "ring twice"
            }
            """;

    private CheckoutResponse postCheckout(UUID userId, String idempotencyKey, int expectedStatus) {
        return webTestClient.post()
                .uri("/api/checkout")
                .header("X-User-Id", userId.toString())
                .header("X-Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CHECKOUT_REQUEST)
                .exchange()
                .expectStatus().isEqualTo(expectedStatus)
                .expectBody(CheckoutResponse.class)
                .returnResult()
                .getResponseBody();
    }

    private String completedOrderId(UUID userId, ProductEntity product, int quantity) {
        givenCart(userId, line(product, quantity));
        stubAccount(userId, true);
        CheckoutResponse accepted = postCheckout(userId, UUID.randomUUID().toString(), 202);
        drainPipeline();
        return webTestClient.get()
                .uri("/api/checkout/{id}", accepted.checkoutId())
                .header("X-User-Id", userId.toString())
                .exchange()
                .expectStatus().isOk()
                .expectBody(CheckoutResponse.class)
                .returnResult()
                .getResponseBody()
                .orderId();
    }

    @Nested
    @DisplayName("POST /api/checkout")
    class SubmitCheckout {

        @Test
        @DisplayName("should_accept_checkout_and_replay_on_same_key - 受理結帳並以相同冪等鍵重放")
        void should_accept_checkout_and_replay_on_same_key() {
            // Given
            UUID userId = UUID.randomUUID();
            ProductEntity product = givenProduct("Keyboard", "49.90", 10);
            givenCart(userId, line(product, 1));
            String idempotencyKey = UUID.randomUUID().toString();

            // When
            CheckoutResponse first = postCheckout(userId, idempotencyKey, 202);
            CheckoutResponse second = postCheckout(userId, idempotencyKey, 200);

            // Then
            assertThat(first.checkoutId()).isNotNull();
            assertThat(first.status()).isEqualTo("accepted");
            assertThat(second.checkoutId()).isEqualTo(first.checkoutId());
        }

        @Test
        @DisplayName("should_return_422_for_empty_cart - 空購物車回傳 422")
        void should_return_422_for_empty_cart() {
            UUID userId = UUID.randomUUID();
            givenCart(userId);

            webTestClient.post()
                    .uri("/api/checkout")
                    .header("X-User-Id", userId.toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(CHECKOUT_REQUEST)
                    .exchange()
                    .expectStatus().isEqualTo(422)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("CHECKOUT_REJECTED")
                    .jsonPath("$.message").isEqualTo("Cart is empty");
        }

        @Test
        @DisplayName("should_return_400_for_missing_address - 缺少地址回傳 400")
        void should_return_400_for_missing_address() {
            webTestClient.post()
                    .uri("/api/checkout")
                    .header("X-User-Id", UUID.randomUUID().toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"notes\": \"no address\"}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
        }

        @Test
        @DisplayName("should_return_400_for_oversized_idempotency_key - 冪等鍵過長回傳 400")
        void should_return_400_for_oversized_idempotency_key() {
            UUID userId = UUID.randomUUID();
            ProductEntity product = givenProduct("Notebook", "4.00", 10);
            givenCart(userId, line(product, 1));

            webTestClient.post()
                    .uri("/api/checkout")
                    .header("X-User-Id", userId.toString())
                    .header("X-Idempotency-Key", "k".repeat(65))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(CHECKOUT_REQUEST)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("INVALID_REQUEST")
                    .jsonPath("$.message").value(message -> assertThat((String) message).contains("at most 64"));

            postCheckout(userId, "k".repeat(64), 202);
        }

        @Test
        @DisplayName("should_return_400_without_user_header - 缺少使用者標頭回傳 400")
        void should_return_400_without_user_header() {
            webTestClient.post()
                    .uri("/api/checkout")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(CHECKOUT_REQUEST)
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("GET /api/checkout/{id}")
    class CheckoutStatus {

        @Test
        @DisplayName("should_report_completed_checkout_with_order - 回報完成的結帳與訂單")
        void should_report_completed_checkout_with_order() {
            UUID userId = UUID.randomUUID();
            ProductEntity product = givenProduct("Monitor", "199.00", 3);

            String orderId = completedOrderId(userId, product, 1);

            assertThat(orderId).isNotBlank();
            assertThat(stockOf(product)).isEqualTo(2);
        }

        @Test
        @DisplayName("should_return_404_for_other_users_checkout - 他人的結帳回傳 404")
        void should_return_404_for_other_users_checkout() {
            UUID owner = UUID.randomUUID();
            ProductEntity product = givenProduct("Mouse", "19.00", 3);
            givenCart(owner, line(product, 1));
            CheckoutResponse accepted = postCheckout(owner, UUID.randomUUID().toString(), 202);

            webTestClient.get()
                    .uri("/api/checkout/{id}", accepted.checkoutId())
                    .header("X-User-Id", UUID.randomUUID().toString())
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("CHECKOUT_NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("Orders")
    class Orders {

        @Test
        @DisplayName("should_list_get_and_cancel_own_order - 查詢、列出並取消自己的訂單")
        void should_list_get_and_cancel_own_order() {
            // Given
            UUID userId = UUID.randomUUID();
            ProductEntity product = givenProduct("Headphones", "89.00", 4);
            String orderId = completedOrderId(userId, product, 2);

            // When & Then: list
            webTestClient.get()
                    .uri("/api/orders?limit=5")
                    .header("X-User-Id", userId.toString())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(1)
                    .jsonPath("$[0].id").isEqualTo(orderId)
                    .jsonPath("$[0].status").isEqualTo("confirmed");

            // When & Then: detail
            webTestClient.get()
                    .uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", userId.toString())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.items.length()").isEqualTo(1)
                    .jsonPath("$.cancellable").isEqualTo(true);

            // When & Then: cancel
            webTestClient.post()
                    .uri("/api/orders/{id}/cancel", orderId)
                    .header("X-User-Id", userId.toString())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("cancelled");

            assertThat(stockOf(product)).isEqualTo(4);

            // When & Then: second cancel conflicts
            webTestClient.post()
                    .uri("/api/orders/{id}/cancel", orderId)
                    .header("X-User-Id", userId.toString())
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.currentStatus").isEqualTo("cancelled");
        }

        @Test
        @DisplayName("should_return_404_for_other_users_order - 他人的訂單回傳 404")
        void should_return_404_for_other_users_order() {
            UUID owner = UUID.randomUUID();
            ProductEntity product = givenProduct("Tripod", "35.00", 4);
            String orderId = completedOrderId(owner, product, 1);

            webTestClient.get()
                    .uri("/api/orders/{id}", orderId)
                    .header("X-User-Id", UUID.randomUUID().toString())
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should_ship_and_deliver_via_admin_api - 透過後台 API 出貨與送達")
        void should_ship_and_deliver_via_admin_api() {
            UUID userId = UUID.randomUUID();
            UUID adminId = UUID.randomUUID();
            ProductEntity product = givenProduct("Speaker", "120.00", 2);
            String orderId = completedOrderId(userId, product, 1);

            webTestClient.put()
                    .uri("/api/admin/orders/{id}/payment-status", orderId)
                    .header("X-User-Id", adminId.toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"paymentStatus\": \"paid\"}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.paymentStatus").isEqualTo("paid");

            webTestClient.post()
                    .uri("/api/admin/orders/{id}/ship", orderId)
                    .header("X-User-Id", adminId.toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"trackingNumber\": \"TRK-2024\"}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("shipped")
                    .jsonPath("$.trackingNumber").isEqualTo("TRK-2024");

            webTestClient.post()
                    .uri("/api/admin/orders/{id}/deliver", orderId)
                    .header("X-User-Id", adminId.toString())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("delivered");
        }
    }

    @Nested
    @DisplayName("PUT /api/admin/stock")
    class AdminStock {

        @Test
        @DisplayName("should_set_variant_stock - 設定規格庫存")
        void should_set_variant_stock() {
            ProductEntity product = givenProduct("Sneaker", "70.00", 0);
            ProductVariantEntity variant = givenVariant(product, "42", null, 3);

            webTestClient.put()
                    .uri("/api/admin/stock/variant/{id}", variant.getId())
                    .header("X-User-Id", UUID.randomUUID().toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"quantity\": 12}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.unitType").isEqualTo("variant")
                    .jsonPath("$.oldQuantity").isEqualTo(3)
                    .jsonPath("$.newQuantity").isEqualTo(12);

            assertThat(stockOf(variant)).isEqualTo(12);
        }

        @Test
        @DisplayName("should_reject_negative_stock - 拒絕負數庫存")
        void should_reject_negative_stock() {
            ProductEntity product = givenProduct("Sandal", "30.00", 5);

            webTestClient.put()
                    .uri("/api/admin/stock/product/{id}", product.getId())
                    .header("X-User-Id", UUID.randomUUID().toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"quantity\": -1}")
                    .exchange()
                    .expectStatus().isBadRequest();

            assertThat(stockOf(product)).isEqualTo(5);
        }

        @Test
        @DisplayName("should_reject_unknown_unit_type - 拒絕未知的庫存單位類型")
        void should_reject_unknown_unit_type() {
            webTestClient.put()
                    .uri("/api/admin/stock/warehouse/{id}", UUID.randomUUID())
                    .header("X-User-Id", UUID.randomUUID().toString())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"quantity\": 1}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
        }
    }
}
