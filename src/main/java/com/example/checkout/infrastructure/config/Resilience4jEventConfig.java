package com.example.checkout.infrastructure.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for Resilience4j event logging.
 */
@Configuration
public class Resilience4jEventConfig {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jEventConfig.class);

    private final RetryRegistry retryRegistry;

    public Resilience4jEventConfig(RetryRegistry retryRegistry) {
        this.retryRegistry = retryRegistry;
    }

    @PostConstruct
    public void registerEventListeners() {
        retryRegistry.getAllRetries().forEach(this::registerRetryEventListener);
        retryRegistry.getEventPublisher()
                .onEntryAdded(event -> registerRetryEventListener(event.getAddedEntry()));
    }

    private void registerRetryEventListener(Retry retry) {
        retry.getEventPublisher()
                .onRetry(event -> log.info(
                        "[RETRY] name={}, attempt={}, waitDuration={}ms, cause={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "N/A"))
                .onError(event -> log.error(
                        "[RETRY_EXHAUSTED] name={}, attempts={}, error={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()))
                .onSuccess(event -> log.debug(
                        "[RETRY_SUCCESS] name={}, attempts={}",
                        event.getName(),
                        event.getNumberOfRetryAttempts()))
                .onIgnoredError(event -> log.debug(
                        "[RETRY_IGNORED] name={}, error={} (not retryable)",
                        event.getName(),
                        event.getLastThrowable().getMessage()));
    }
}
