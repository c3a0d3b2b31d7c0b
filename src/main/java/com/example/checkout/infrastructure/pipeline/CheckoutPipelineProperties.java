package com.example.checkout.infrastructure.pipeline;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Stage retry settings. {@code maxAttempts} counts the first execution.
 */
@ConfigurationProperties(prefix = "checkout.pipeline")
public record CheckoutPipelineProperties(
        @DefaultValue("4") int maxAttempts,
        @DefaultValue("60s") Duration initialBackoff,
        @DefaultValue("2.0") double backoffMultiplier
) {
    public CheckoutPipelineProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("checkout.pipeline.max-attempts must be at least 1");
        }
    }
}
