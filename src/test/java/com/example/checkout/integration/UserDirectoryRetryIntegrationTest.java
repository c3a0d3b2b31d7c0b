package com.example.checkout.integration;

import com.example.checkout.application.port.out.UserDirectoryPort;
import com.example.checkout.application.port.out.UserDirectoryPort.Customer;
import com.example.checkout.infrastructure.exception.NonRetryableServiceException;
import com.example.checkout.infrastructure.exception.ServiceUnavailableException;
import com.example.checkout.support.IntegrationTestSupport;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.ActiveProfiles;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the accounts lookup and its resilience4j retry.
 */
@ActiveProfiles("test")
@DisplayName("User Directory Retry Integration Tests")
class UserDirectoryRetryIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private UserDirectoryPort userDirectory;

    @Autowired
    private RetryRegistry retryRegistry;

    @Nested
    @DisplayName("Transient Errors")
    class TransientErrors {

        @Test
        @DisplayName("should_retry_on_503_and_succeed - 503 時重試並成功")
        void should_retry_on_503_and_succeed() {
            // Given: accounts fails twice with 503, then succeeds
            UUID userId = UUID.randomUUID();
            stubAccountTransientFailureThenSuccess(userId, 2);

            // When
            Optional<Customer> customer = userDirectory.byId(userId).join();

            // Then
            assertThat(customer).isPresent();
            assertThat(customer.get().id()).isEqualTo(userId);
            assertThat(customer.get().fullName()).isEqualTo("Mei Lin");
            assertThat(customer.get().active()).isTrue();
            verifyAccountLookups(userId, 3);
        }

        @Test
        @DisplayName("should_fail_with_service_unavailable_after_retries - 重試耗盡後回報服務不可用")
        void should_fail_with_service_unavailable_after_retries() {
            // Given
            UUID userId = UUID.randomUUID();
            stubAccountsPermanentFailure();

            // When & Then
            assertThatThrownBy(() -> userDirectory.byId(userId).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(ServiceUnavailableException.class);
            verifyAccountLookups(userId, 3);
        }
    }

    @Nested
    @DisplayName("Permanent Errors")
    class PermanentErrors {

        @Test
        @DisplayName("should_return_empty_for_unknown_user - 使用者不存在時回傳空值")
        void should_return_empty_for_unknown_user() {
            UUID userId = UUID.randomUUID();
            stubAccountNotFound(userId);

            Optional<Customer> customer = userDirectory.byId(userId).join();

            assertThat(customer).isEmpty();
            verifyAccountLookups(userId, 1);
        }

        @Test
        @DisplayName("should_not_retry_on_400 - 400 錯誤不重試")
        void should_not_retry_on_400() {
            UUID userId = UUID.randomUUID();
            stubAccountsBadRequest();

            assertThatThrownBy(() -> userDirectory.byId(userId).join())
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(NonRetryableServiceException.class);
            verifyAccountLookups(userId, 1);
        }
    }

    @Test
    @DisplayName("should_register_both_retry_instances - 註冊帳號與結帳階段的重試設定")
    void should_register_both_retry_instances() {
        assertThat(retryRegistry.find("userDirectory")).isPresent();
        assertThat(retryRegistry.find("checkoutStage")).isPresent();
        assertThat(retryRegistry.retry("userDirectory").getRetryConfig().getMaxAttempts()).isEqualTo(3);
    }
}
