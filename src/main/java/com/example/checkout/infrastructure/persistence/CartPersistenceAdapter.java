package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.CartPort;
import com.example.checkout.domain.model.CartLine;
import com.example.checkout.domain.model.CartSnapshot;
import com.example.checkout.infrastructure.persistence.entity.CartEntity;
import com.example.checkout.infrastructure.persistence.repository.CartJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Component
public class CartPersistenceAdapter implements CartPort {

    private static final Logger log = LoggerFactory.getLogger(CartPersistenceAdapter.class);

    private final CartJpaRepository cartRepository;
    private final Clock clock;

    public CartPersistenceAdapter(CartJpaRepository cartRepository, Clock clock) {
        this.cartRepository = cartRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Optional<CartSnapshot> snapshotLines(UUID userId) {
        return cartRepository.findByUserIdForUpdate(userId).map(this::toSnapshot);
    }

    @Override
    @Transactional
    public Optional<CartSnapshot> lockForCheckout(UUID cartId) {
        return cartRepository.findByIdForUpdate(cartId).map(this::toSnapshot);
    }

    @Override
    @Transactional
    public void clear(UUID cartId) {
        cartRepository.findById(cartId).ifPresent(cart -> {
            int removed = cart.getItems().size();
            cart.getItems().clear();
            cartRepository.save(cart);
            log.info("Cleared cart {} ({} lines)", cartId, removed);
        });
    }

    private CartSnapshot toSnapshot(CartEntity cart) {
        List<CartLine> lines = cart.getItems().stream()
                .map(item -> new CartLine(item.getProductId(), item.getVariantId(), item.getQuantity()))
                .toList();
        return new CartSnapshot(cart.getId(), cart.getUserId(), lines, clock.instant());
    }
}
