package com.example.checkout.infrastructure.adapter.out.accounts;

import com.example.checkout.application.port.out.UserDirectoryPort;
import com.example.checkout.infrastructure.adapter.out.accounts.dto.AccountResponse;
import com.example.checkout.infrastructure.adapter.out.accounts.mapper.AccountMapper;
import com.example.checkout.infrastructure.exception.NonRetryableServiceException;
import com.example.checkout.infrastructure.exception.RetryableServiceException;
import com.example.checkout.infrastructure.exception.ServiceUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter for the accounts service with retry mechanism.
 * A 404 means the account does not exist and completes with an empty result.
 */
@Component
public class AccountsServiceAdapter implements UserDirectoryPort {

    private static final Logger log = LoggerFactory.getLogger(AccountsServiceAdapter.class);
    private static final String SERVICE_NAME = "accounts";

    private final WebClient webClient;
    private final AccountMapper mapper;

    public AccountsServiceAdapter(
            @Qualifier("accountsWebClient") WebClient webClient,
            AccountMapper mapper) {
        this.webClient = webClient;
        this.mapper = mapper;
    }

    @Override
    @Retry(name = "userDirectory", fallbackMethod = "byIdFallback")
    public CompletableFuture<Optional<Customer>> byId(UUID userId) {
        log.debug("Looking up account: {}", userId);

        return webClient.get()
                .uri("/api/users/{id}", userId)
                .retrieve()
                .onStatus(status -> status.is4xxClientError() && status.value() != HttpStatus.NOT_FOUND.value(),
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new NonRetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Accounts service error: " + body))))
                .onStatus(HttpStatusCode::is5xxServerError, response ->
                        response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new RetryableServiceException(
                                        SERVICE_NAME, response.statusCode().value(),
                                        "Accounts service temporarily unavailable"))))
                .bodyToMono(AccountResponse.class)
                .map(mapper::toCustomer)
                .map(Optional::of)
                .onErrorResume(WebClientResponseException.NotFound.class, ex -> {
                    log.debug("Account not found: {}", userId);
                    return Mono.just(Optional.empty());
                })
                .toFuture();
    }

    /**
     * Fallback method when all retries are exhausted.
     */
    @SuppressWarnings("unused")
    private CompletableFuture<Optional<Customer>> byIdFallback(UUID userId, Throwable throwable) {
        log.error("Account lookup failed after retries for user: {}, cause: {}",
                userId, throwable.getMessage());

        if (throwable instanceof NonRetryableServiceException) {
            return CompletableFuture.failedFuture(throwable);
        }

        return CompletableFuture.failedFuture(
                new ServiceUnavailableException(
                        SERVICE_NAME,
                        "Account lookup temporarily unavailable",
                        throwable));
    }
}
