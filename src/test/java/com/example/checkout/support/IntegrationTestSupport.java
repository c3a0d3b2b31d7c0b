package com.example.checkout.support;

import com.example.checkout.domain.model.Address;
import com.example.checkout.infrastructure.persistence.entity.CartEntity;
import com.example.checkout.infrastructure.persistence.entity.CartItemEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductStatus;
import com.example.checkout.infrastructure.persistence.entity.ProductVariantEntity;
import com.example.checkout.infrastructure.persistence.repository.CartJpaRepository;
import com.example.checkout.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.checkout.infrastructure.persistence.repository.ProductVariantJpaRepository;
import com.example.checkout.infrastructure.pipeline.CheckoutTaskDispatcher;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base class for integration tests that use WireMock and H2 in-memory database.
 * Provides a WireMock server for the accounts service and catalog/cart fixtures.
 *
 * Note: For Testcontainers PostgreSQL tests, extend PostgresTestContainerSupport instead.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class IntegrationTestSupport {

    // Static server initialized at class loading time (before @DynamicPropertySource)
    protected static WireMockServer accountsServer;

    static {
        accountsServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        accountsServer.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> accountsServer.stop()));
    }

    protected static final Address SHIPPING_ADDRESS = new Address("Mei", "Lin", "100 Songren Rd", "8F",
            "Taipei", "Xinyi", "110", "TW", "+886-2-1234-5678");

    @Autowired
    protected ProductJpaRepository productRepository;

    @Autowired
    protected ProductVariantJpaRepository variantRepository;

    @Autowired
    protected CartJpaRepository cartRepository;

    @Autowired
    protected CheckoutTaskDispatcher dispatcher;

    @BeforeEach
    void resetStateBeforeTest() {
        accountsServer.resetAll();
    }

    @AfterEach
    void resetWireMockServer() {
        accountsServer.resetAll();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("services.accounts.base-url", () -> accountsServer.baseUrl());

        // H2 in-memory database configuration (for portability)
        registry.add("spring.datasource.url",
                () -> "jdbc:h2:mem:checkoutdb_test;DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE;LOCK_TIMEOUT=10000");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
        registry.add("spring.datasource.driver-class-name", () -> "org.h2.Driver");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
        registry.add("spring.jpa.properties.hibernate.dialect", () -> "org.hibernate.dialect.H2Dialect");

        // Tests drive the pipeline through the dispatcher directly
        registry.add("checkout.poller.enabled", () -> "false");
    }

    // ==================== Pipeline ====================

    /**
     * Runs every due task on the calling thread until the queue is empty, treating
     * rescheduled tasks as immediately due.
     */
    protected void drainPipeline() {
        for (int round = 0; round < 50; round++) {
            Instant farFuture = Instant.now().plus(Duration.ofDays(1));
            if (dispatcher.dispatchDue(farFuture, Runnable::run) == 0) {
                return;
            }
        }
        throw new IllegalStateException("Checkout pipeline did not drain");
    }

    // ==================== Catalog & Cart Fixtures ====================

    protected ProductEntity givenProduct(String name, String price, int stock) {
        ProductEntity product = new ProductEntity();
        product.setId(UUID.randomUUID());
        product.setName(name);
        product.setSku(name.toUpperCase().replace(' ', '-') + "-" + UUID.randomUUID().toString().substring(0, 8));
        product.setPrice(new BigDecimal(price));
        product.setStatus(ProductStatus.ACTIVE);
        product.setTrackInventory(true);
        product.setStockQuantity(stock);
        return productRepository.save(product);
    }

    protected ProductVariantEntity givenVariant(ProductEntity product, String name, String price, int stock) {
        ProductVariantEntity variant = new ProductVariantEntity();
        variant.setId(UUID.randomUUID());
        variant.setProductId(product.getId());
        variant.setName(name);
        variant.setSku(product.getSku() + "-" + name.toUpperCase());
        variant.setPrice(price != null ? new BigDecimal(price) : null);
        variant.setActive(true);
        variant.setStockQuantity(stock);
        return variantRepository.save(variant);
    }

    protected CartEntity givenCart(UUID userId, CartLineFixture... lines) {
        CartEntity cart = new CartEntity();
        cart.setId(UUID.randomUUID());
        cart.setUserId(userId);
        for (CartLineFixture line : lines) {
            CartItemEntity item = new CartItemEntity();
            item.setProductId(line.productId());
            item.setVariantId(line.variantId());
            item.setQuantity(line.quantity());
            cart.addItem(item);
        }
        return cartRepository.save(cart);
    }

    protected static CartLineFixture line(ProductEntity product, int quantity) {
        return new CartLineFixture(product.getId(), null, quantity);
    }

    protected static CartLineFixture line(ProductVariantEntity variant, int quantity) {
        return new CartLineFixture(variant.getProductId(), variant.getId(), quantity);
    }

    protected int stockOf(ProductEntity product) {
        return productRepository.findById(product.getId()).orElseThrow().getStockQuantity();
    }

    protected int stockOf(ProductVariantEntity variant) {
        return variantRepository.findById(variant.getId()).orElseThrow().getStockQuantity();
    }

    protected record CartLineFixture(UUID productId, UUID variantId, int quantity) {
    }

    // ==================== Accounts Stubs ====================

    /**
     * Stubs the accounts service to return an account for {@code userId}.
     */
    protected void stubAccount(UUID userId, boolean active) {
        accountsServer.stubFor(get(urlEqualTo("/api/users/" + userId))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "id": "%s",
                                    "email": "mei.lin@example.com",
                                    "first_name": "Mei",
                                    "last_name": "Lin",
                                    "is_active": %s
                                }
                                """.formatted(userId, active))));
    }

    /**
     * Stubs the accounts service to return 404 for {@code userId}.
     */
    protected void stubAccountNotFound(UUID userId) {
        accountsServer.stubFor(get(urlEqualTo("/api/users/" + userId))
                .willReturn(aResponse()
                        .withStatus(404)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {"detail": "Not found."}
                                """)));
    }

    /**
     * Stubs the accounts service to fail transiently then succeed.
     * Uses WireMock Scenarios for stateful behavior.
     */
    protected void stubAccountTransientFailureThenSuccess(UUID userId, int failCount) {
        String scenarioName = "AccountsTransientFailure";

        for (int i = 0; i < failCount; i++) {
            String currentState = i == 0 ? Scenario.STARTED : "Attempt" + i;
            String nextState = "Attempt" + (i + 1);

            accountsServer.stubFor(get(urlEqualTo("/api/users/" + userId))
                    .inScenario(scenarioName)
                    .whenScenarioStateIs(currentState)
                    .willSetStateTo(nextState)
                    .willReturn(aResponse()
                            .withStatus(503)
                            .withHeader("Content-Type", "application/json")
                            .withBody("""
                                    {"detail": "Service temporarily unavailable"}
                                    """)));
        }

        accountsServer.stubFor(get(urlEqualTo("/api/users/" + userId))
                .inScenario(scenarioName)
                .whenScenarioStateIs("Attempt" + failCount)
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {
                                    "id": "%s",
                                    "email": "mei.lin@example.com",
                                    "first_name": "Mei",
                                    "last_name": "Lin",
                                    "is_active": true
                                }
                                """.formatted(userId))));
    }

    /**
     * Stubs the accounts service to always fail with 503.
     */
    protected void stubAccountsPermanentFailure() {
        accountsServer.stubFor(get(urlPathMatching("/api/users/.*"))
                .willReturn(aResponse()
                        .withStatus(503)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {"detail": "Service unavailable"}
                                """)));
    }

    /**
     * Stubs the accounts service to return 400 Bad Request.
     */
    protected void stubAccountsBadRequest() {
        accountsServer.stubFor(get(urlPathMatching("/api/users/.*"))
                .willReturn(aResponse()
                        .withStatus(400)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                                {"detail": "Invalid user id"}
                                """)));
    }

    // ==================== Verification Helpers ====================

    protected void verifyAccountLookups(UUID userId, int expectedCount) {
        accountsServer.verify(expectedCount, getRequestedFor(urlEqualTo("/api/users/" + userId)));
    }
}
