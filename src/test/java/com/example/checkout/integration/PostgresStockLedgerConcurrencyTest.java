package com.example.checkout.integration;

import com.example.checkout.application.port.out.StockLedgerPort;
import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.model.StockUnitRef;
import com.example.checkout.infrastructure.persistence.entity.ProductEntity;
import com.example.checkout.infrastructure.persistence.entity.ProductStatus;
import com.example.checkout.infrastructure.persistence.repository.ProductJpaRepository;
import com.example.checkout.support.PostgresTestContainerSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Row-lock behaviour of the stock ledger against a real PostgreSQL.
 */
@ActiveProfiles("test")
@DisplayName("PostgreSQL Stock Ledger Concurrency Tests")
class PostgresStockLedgerConcurrencyTest extends PostgresTestContainerSupport {

    @Autowired
    private StockLedgerPort stockLedger;

    @Autowired
    private ProductJpaRepository productRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private ProductEntity givenProduct(int stock) {
        ProductEntity product = new ProductEntity();
        product.setId(UUID.randomUUID());
        product.setName("Concert Ticket");
        product.setSku("TICKET-" + UUID.randomUUID().toString().substring(0, 8));
        product.setPrice(new BigDecimal("80.00"));
        product.setStatus(ProductStatus.ACTIVE);
        product.setTrackInventory(true);
        product.setStockQuantity(stock);
        return productRepository.save(product);
    }

    @Test
    @DisplayName("should_serialize_deductions_on_locked_row - 鎖定列上的扣減依序執行")
    void should_serialize_deductions_on_locked_row() throws Exception {
        // Given: 10 in stock, 8 buyers of 2 each
        ProductEntity product = givenProduct(10);
        StockUnitRef unit = StockUnitRef.product(product.getId());
        TransactionTemplate tx = new TransactionTemplate(transactionManager);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);

        // When
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    tx.executeWithoutResult(status -> stockLedger.reduce(unit, 2));
                    succeeded.incrementAndGet();
                } catch (InsufficientStockException e) {
                    rejected.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then: exactly five fit, the rest see the refreshed counter
        assertThat(succeeded.get()).isEqualTo(5);
        assertThat(rejected.get()).isEqualTo(3);
        assertThat(productRepository.findById(product.getId()).orElseThrow().getStockQuantity()).isZero();
    }
}
