package com.example.checkout.unit.pipeline;

import com.example.checkout.domain.exception.InsufficientStockException;
import com.example.checkout.domain.exception.ValidationException;
import com.example.checkout.domain.model.StockUnitRef;
import com.example.checkout.infrastructure.exception.NonRetryableServiceException;
import com.example.checkout.infrastructure.exception.RetryableServiceException;
import com.example.checkout.infrastructure.exception.ServiceUnavailableException;
import com.example.checkout.infrastructure.pipeline.CheckoutPipelineProperties;
import com.example.checkout.infrastructure.pipeline.StageRetryPolicy;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Stage Retry Policy Tests")
class StageRetryPolicyTest {

    private RetryRegistry retryRegistry;
    private StageRetryPolicy policy;

    @BeforeEach
    void setUp() {
        retryRegistry = RetryRegistry.ofDefaults();
        policy = new StageRetryPolicy(
                new CheckoutPipelineProperties(4, Duration.ofSeconds(60), 2.0), retryRegistry);
    }

    @Nested
    @DisplayName("Transient Failures")
    class TransientFailures {

        @Test
        @DisplayName("should_back_off_exponentially - 指數退避 60s/120s/240s")
        void should_back_off_exponentially() {
            // Given
            RetryableServiceException failure = new RetryableServiceException("accounts", 503, "unavailable");

            // When & Then
            assertThat(policy.nextDelay(failure, 1)).contains(Duration.ofSeconds(60));
            assertThat(policy.nextDelay(failure, 2)).contains(Duration.ofSeconds(120));
            assertThat(policy.nextDelay(failure, 3)).contains(Duration.ofSeconds(240));
        }

        @Test
        @DisplayName("should_give_up_after_max_attempts - 達到最大次數後放棄")
        void should_give_up_after_max_attempts() {
            ServiceUnavailableException failure = new ServiceUnavailableException("accounts", "down");

            assertThat(policy.maxAttempts()).isEqualTo(4);
            assertThat(policy.nextDelay(failure, 4)).isEmpty();
        }

        @Test
        @DisplayName("should_treat_transient_data_access_as_retryable - 暫時性資料庫錯誤可重試")
        void should_treat_transient_data_access_as_retryable() {
            assertThat(policy.nextDelay(new QueryTimeoutException("lock wait"), 1)).isPresent();
        }

        @Test
        @DisplayName("should_find_transient_cause_in_chain - 由例外鏈找出暫時性原因")
        void should_find_transient_cause_in_chain() {
            RuntimeException wrapped = new RuntimeException("stage failed",
                    new ServiceUnavailableException("accounts", "down"));

            assertThat(policy.nextDelay(wrapped, 1)).contains(Duration.ofSeconds(60));
        }
    }

    @Nested
    @DisplayName("Permanent Failures")
    class PermanentFailures {

        @Test
        @DisplayName("should_not_retry_business_rule_failures - 業務規則錯誤不重試")
        void should_not_retry_business_rule_failures() {
            assertThat(policy.nextDelay(new ValidationException("Product is not active"), 1)).isEmpty();
            assertThat(policy.nextDelay(new InsufficientStockException(StockUnitRef.product(UUID.randomUUID()), 10, 3), 1)).isEmpty();
        }

        @Test
        @DisplayName("should_not_retry_client_errors - 4xx 錯誤不重試")
        void should_not_retry_client_errors() {
            assertThat(policy.nextDelay(new NonRetryableServiceException("accounts", 400, "bad"), 1)).isEmpty();
        }

        @Test
        @DisplayName("should_not_retry_unclassified_failures - 未分類錯誤不重試")
        void should_not_retry_unclassified_failures() {
            assertThat(policy.nextDelay(new IllegalStateException("bug"), 1)).isEmpty();
        }
    }

    @Test
    @DisplayName("should_register_stage_retry_in_registry - 於 RetryRegistry 註冊")
    void should_register_stage_retry_in_registry() {
        assertThat(retryRegistry.find(StageRetryPolicy.RETRY_NAME)).isPresent();
        assertThat(retryRegistry.retry(StageRetryPolicy.RETRY_NAME).getRetryConfig().getMaxAttempts()).isEqualTo(4);
    }

    @Test
    @DisplayName("should_decide_without_executing_registered_retry - 僅使用設定判斷，不執行 Retry")
    void should_decide_without_executing_registered_retry() {
        // Given: an event listener on the registered instance
        AtomicInteger events = new AtomicInteger();
        Retry retry = retryRegistry.retry(StageRetryPolicy.RETRY_NAME);
        retry.getEventPublisher().onEvent(event -> events.incrementAndGet());

        // When
        policy.nextDelay(new RetryableServiceException("accounts", 503, "unavailable"), 1);
        policy.nextDelay(new RetryableServiceException("accounts", 503, "unavailable"), 4);

        // Then: decisions are logged by the policy, the Retry itself never runs
        assertThat(events.get()).isZero();
        assertThat(retry.getMetrics().getNumberOfFailedCallsWithRetryAttempt()).isZero();
    }
}
