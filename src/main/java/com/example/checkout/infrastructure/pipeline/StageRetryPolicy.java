package com.example.checkout.infrastructure.pipeline;

import com.example.checkout.domain.exception.DomainException;
import com.example.checkout.infrastructure.exception.TransientInfraException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decides whether a failed stage execution is retried and after how long.
 * <p>
 * The decision is taken between executions rather than inside one, because a retry is a
 * rescheduled task in the durable queue. The resilience4j {@link RetryConfig} registered as
 * {@code checkoutStage} is the single source for the exception classification and backoff.
 */
@Component
public class StageRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(StageRetryPolicy.class);

    public static final String RETRY_NAME = "checkoutStage";

    private final Retry retry;
    private final IntervalFunction intervalFunction;

    public StageRetryPolicy(CheckoutPipelineProperties properties, RetryRegistry retryRegistry) {
        this.intervalFunction = IntervalFunction.ofExponentialBackoff(
                properties.initialBackoff(), properties.backoffMultiplier());
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(properties.maxAttempts())
                .intervalFunction(intervalFunction)
                .retryOnException(StageRetryPolicy::isTransient)
                .ignoreExceptions(DomainException.class)
                .build();
        this.retry = retryRegistry.retry(RETRY_NAME, config);
    }

    /**
     * @param failure      what the stage threw
     * @param attemptsMade executions so far, including the one that just failed
     * @return the delay before the next execution, or empty when the task should fail for good
     */
    public Optional<Duration> nextDelay(Throwable failure, int attemptsMade) {
        Predicate<Throwable> retryable = retry.getRetryConfig().getExceptionPredicate();
        if (!retryable.test(failure)) {
            log.warn("[RETRY_IGNORED] name={}, attempt={}, cause={}",
                    RETRY_NAME, attemptsMade, describe(failure));
            return Optional.empty();
        }
        if (attemptsMade >= retry.getRetryConfig().getMaxAttempts()) {
            log.error("[RETRY_EXHAUSTED] name={}, attempts={}, cause={}",
                    RETRY_NAME, attemptsMade, describe(failure));
            return Optional.empty();
        }
        Duration wait = Duration.ofMillis(intervalFunction.apply(attemptsMade));
        log.warn("[RETRY] name={}, attempt={}, waitDuration={}, cause={}",
                RETRY_NAME, attemptsMade, wait, describe(failure));
        return Optional.of(wait);
    }

    public int maxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    static boolean isTransient(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof TransientInfraException
                    || t instanceof TransientDataAccessException
                    || t instanceof CannotCreateTransactionException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String describe(Throwable failure) {
        return failure.getClass().getSimpleName() + ": " + failure.getMessage();
    }
}
