package com.example.checkout.application.service;

import com.example.checkout.application.port.out.OrderStorePort;
import com.example.checkout.domain.model.OrderNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Issues order numbers, drawing again when a candidate is already taken.
 */
@Component
public class OrderNumberGenerator {

    private static final Logger log = LoggerFactory.getLogger(OrderNumberGenerator.class);
    private static final int MAX_DRAWS = 5;

    private final OrderStorePort orderStore;
    private final Clock clock;

    public OrderNumberGenerator(OrderStorePort orderStore, Clock clock) {
        this.orderStore = orderStore;
        this.clock = clock;
    }

    public OrderNumber next() {
        for (int draw = 1; draw <= MAX_DRAWS; draw++) {
            OrderNumber candidate = OrderNumber.generate(clock.instant(), ThreadLocalRandom.current());
            if (!orderStore.existsByOrderNumber(candidate)) {
                return candidate;
            }
            log.warn("Order number collision on {} (draw {}/{})", candidate, draw, MAX_DRAWS);
        }
        throw new IllegalStateException("Could not allocate a unique order number after " + MAX_DRAWS + " draws");
    }
}
