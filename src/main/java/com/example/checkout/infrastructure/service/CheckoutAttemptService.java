package com.example.checkout.infrastructure.service;

import com.example.checkout.application.port.out.CheckoutAttemptPort;
import com.example.checkout.domain.exception.CheckoutNotFoundException;
import com.example.checkout.domain.model.CheckoutAttempt;
import com.example.checkout.domain.model.CheckoutStatus;
import com.example.checkout.infrastructure.persistence.entity.CheckoutAttemptEntity;
import com.example.checkout.infrastructure.persistence.repository.CheckoutAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Stores checkout attempts keyed by the client's idempotency key.
 * Terminal attempts expire after {@code checkout.attempt.expiry-hours}; in-flight ones are never purged.
 */
@Service
public class CheckoutAttemptService implements CheckoutAttemptPort {

    private static final Logger log = LoggerFactory.getLogger(CheckoutAttemptService.class);

    private static final Set<CheckoutStatus> IN_FLIGHT = EnumSet.copyOf(Arrays.stream(CheckoutStatus.values())
            .filter(status -> !status.isTerminal())
            .toList());
    private static final List<CheckoutStatus> TERMINAL = List.of(CheckoutStatus.COMPLETED, CheckoutStatus.FAILED);

    private final CheckoutAttemptRepository repository;
    private final Clock clock;
    private final int expiryHours;

    public CheckoutAttemptService(
            CheckoutAttemptRepository repository,
            Clock clock,
            @Value("${checkout.attempt.expiry-hours:24}") int expiryHours) {
        this.repository = repository;
        this.clock = clock;
        this.expiryHours = expiryHours;
    }

    @Override
    @Transactional
    public CheckoutAttempt save(CheckoutAttempt attempt) {
        CheckoutAttemptEntity entity = repository.findById(attempt.checkoutId())
                .orElseGet(CheckoutAttemptEntity::new);
        entity.setId(attempt.checkoutId());
        entity.setIdempotencyKey(attempt.idempotencyKey());
        entity.setUserId(attempt.userId());
        entity.setCartId(attempt.cartId());
        entity.setStatus(attempt.status());
        entity.setOrderId(attempt.orderId());
        entity.setFailureReason(attempt.failureReason());
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(attempt.createdAt());
        }
        entity.setExpiresAt(entity.getCreatedAt().plus(expiryHours, ChronoUnit.HOURS));

        CheckoutAttempt saved = toDomain(repository.saveAndFlush(entity));
        log.debug("Saved checkout attempt {} (key={}, status={})",
                saved.checkoutId(), saved.idempotencyKey(), saved.status());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CheckoutAttempt> findById(UUID checkoutId) {
        return repository.findById(checkoutId).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CheckoutAttempt> findByIdempotencyKey(String idempotencyKey) {
        return repository.findByIdempotencyKey(idempotencyKey).map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasAttemptInFlight(UUID cartId) {
        return repository.existsByCartIdAndStatusIn(cartId, IN_FLIGHT);
    }

    /**
     * Moves the attempt forward. Never moves it backwards or out of a terminal status.
     */
    @Override
    @Transactional
    public void advance(UUID checkoutId, CheckoutStatus status, String orderId) {
        CheckoutAttemptEntity entity = repository.findById(checkoutId)
                .orElseThrow(() -> new CheckoutNotFoundException(checkoutId));
        if (entity.getStatus().isTerminal() || entity.getStatus().ordinal() >= status.ordinal()) {
            log.debug("Checkout {} already at {}, not moving to {}", checkoutId, entity.getStatus(), status);
            return;
        }
        entity.setStatus(status);
        if (orderId != null) {
            entity.setOrderId(orderId);
        }
        repository.save(entity);
        log.info("Checkout {} -> {}", checkoutId, status.wireValue());
    }

    @Override
    @Transactional
    public void markFailed(UUID checkoutId, String reason) {
        repository.findById(checkoutId).ifPresentOrElse(
                entity -> {
                    if (entity.getStatus() == CheckoutStatus.COMPLETED) {
                        log.warn("Checkout {} already completed, ignoring failure: {}", checkoutId, reason);
                        return;
                    }
                    entity.setStatus(CheckoutStatus.FAILED);
                    entity.setFailureReason(reason);
                    repository.save(entity);
                    log.warn("Checkout {} failed: {}", checkoutId, reason);
                },
                () -> log.warn("No checkout attempt found for id: {}", checkoutId)
        );
    }

    /**
     * Cleans up expired terminal attempts.
     * Runs every hour.
     */
    @Scheduled(fixedRate = 3600000) // Every hour
    @Transactional
    public void cleanupExpiredAttempts() {
        int deleted = repository.deleteExpired(clock.instant(), TERMINAL);
        if (deleted > 0) {
            log.info("Cleaned up {} expired checkout attempts", deleted);
        }
    }

    private CheckoutAttempt toDomain(CheckoutAttemptEntity entity) {
        return new CheckoutAttempt(entity.getId(), entity.getIdempotencyKey(), entity.getUserId(),
                entity.getCartId(), entity.getStatus(), entity.getOrderId(), entity.getFailureReason(),
                entity.getCreatedAt(), entity.getUpdatedAt());
    }
}
