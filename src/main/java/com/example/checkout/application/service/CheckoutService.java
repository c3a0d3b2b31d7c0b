package com.example.checkout.application.service;

import com.example.checkout.application.dto.CheckoutReceipt;
import com.example.checkout.application.dto.SubmitCheckoutCommand;
import com.example.checkout.application.pipeline.CheckoutRequest;
import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.application.port.in.SubmitCheckoutUseCase;
import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.application.port.out.CheckoutAttemptPort;
import com.example.checkout.application.port.out.CheckoutQueuePort;
import com.example.checkout.application.port.out.OrderNotificationPort;
import com.example.checkout.domain.exception.CheckoutNotFoundException;
import com.example.checkout.domain.exception.CheckoutRejectedException;
import com.example.checkout.domain.model.CartSnapshot;
import com.example.checkout.domain.model.CheckoutAttempt;
import com.example.checkout.domain.model.CheckoutStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Accepts checkout submissions and hands them to the pipeline.
 */
@Service
public class CheckoutService implements SubmitCheckoutUseCase {

    private static final Logger log = LoggerFactory.getLogger(CheckoutService.class);

    private final CartPort cartPort;
    private final CheckoutAttemptPort attemptPort;
    private final CheckoutQueuePort queuePort;
    private final OrderNotificationPort notifications;
    private final Clock clock;

    public CheckoutService(
            CartPort cartPort,
            CheckoutAttemptPort attemptPort,
            CheckoutQueuePort queuePort,
            OrderNotificationPort notifications,
            Clock clock) {
        this.cartPort = cartPort;
        this.attemptPort = attemptPort;
        this.queuePort = queuePort;
        this.notifications = notifications;
        this.clock = clock;
    }

    @Override
    @Transactional
    public CheckoutReceipt submit(SubmitCheckoutCommand command) {
        // Held until commit; a concurrent submission for the same cart waits here
        Optional<CartSnapshot> lockedCart = cartPort.snapshotLines(command.userId());

        Optional<CheckoutAttempt> existing = attemptPort.findByIdempotencyKey(command.idempotencyKey());
        if (existing.isPresent()) {
            CheckoutAttempt attempt = existing.get();
            if (!attempt.userId().equals(command.userId())) {
                throw new CheckoutRejectedException("Idempotency key is already in use");
            }
            log.info("Returning existing checkout {} for idempotency key: {}",
                    attempt.checkoutId(), command.idempotencyKey());
            return CheckoutReceipt.duplicate(attempt);
        }

        CartSnapshot cart = lockedCart
                .orElseThrow(() -> new CheckoutRejectedException("No cart found for user " + command.userId()));
        if (cart.isEmpty()) {
            throw new CheckoutRejectedException("Cart is empty");
        }
        if (attemptPort.hasAttemptInFlight(cart.cartId())) {
            throw new CheckoutRejectedException("A checkout for this cart is already in progress");
        }

        CheckoutAttempt attempt = attemptPort.save(CheckoutAttempt.accept(
                command.idempotencyKey(), command.userId(), cart.cartId(), clock.instant()));

        queuePort.enqueue(CheckoutStep.VALIDATE_INVENTORY, new CheckoutRequest(
                attempt.checkoutId(),
                command.userId(),
                cart.cartId(),
                cart.lines(),
                command.shippingAddress(),
                command.billingAddress(),
                command.notes()));

        notifications.checkoutProgress(command.userId(), attempt.checkoutId(),
                CheckoutStatus.ACCEPTED.wireValue(), null, null);

        log.info("Accepted checkout {} for cart {} with {} line(s)",
                attempt.checkoutId(), cart.cartId(), cart.lines().size());
        return CheckoutReceipt.accepted(attempt);
    }

    @Override
    @Transactional(readOnly = true)
    public CheckoutReceipt status(UUID checkoutId, UUID userId) {
        return attemptPort.findById(checkoutId)
                .filter(attempt -> attempt.userId().equals(userId))
                .map(attempt -> CheckoutReceipt.from(attempt, false))
                .orElseThrow(() -> new CheckoutNotFoundException(checkoutId));
    }
}
