package com.example.checkout.infrastructure.persistence.entity;

import com.example.checkout.application.pipeline.CheckoutStep;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable queue row for one pipeline step of one checkout.
 * The (checkout, step) pair is unique, so a step is never enqueued twice.
 */
@Entity
@Table(name = "checkout_tasks",
        uniqueConstraints = @UniqueConstraint(name = "uk_checkout_tasks_step", columnNames = {"checkout_id", "step"}),
        indexes = {
            @Index(name = "idx_checkout_tasks_due", columnList = "status, next_attempt_at"),
            @Index(name = "idx_checkout_tasks_created_at", columnList = "created_at")
        })
public class CheckoutTaskEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "checkout_id", nullable = false)
    private UUID checkoutId;

    @Column(name = "step", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private CheckoutStep step;

    @Column(name = "payload", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "status", length = 32, nullable = false)
    @Enumerated(EnumType.STRING)
    private CheckoutTaskStatus status = CheckoutTaskStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @Column(name = "next_attempt_at", nullable = false)
    private Instant nextAttemptAt;

    @Column(name = "locked_at")
    private Instant lockedAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (nextAttemptAt == null) {
            nextAttemptAt = createdAt;
        }
    }

    public void markProcessed(Instant now) {
        this.status = CheckoutTaskStatus.PROCESSED;
        this.processedAt = now;
        this.lockedAt = null;
    }

    public void markFailed(String error, Instant now) {
        this.status = CheckoutTaskStatus.FAILED;
        this.lastError = truncate(error);
        this.processedAt = now;
        this.lockedAt = null;
    }

    public void reschedule(String error, Instant nextAttemptAt) {
        this.status = CheckoutTaskStatus.PENDING;
        this.lastError = truncate(error);
        this.nextAttemptAt = nextAttemptAt;
        this.lockedAt = null;
    }

    private static String truncate(String error) {
        if (error != null && error.length() > 1000) {
            return error.substring(0, 1000);
        }
        return error;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public UUID getCheckoutId() {
        return checkoutId;
    }

    public void setCheckoutId(UUID checkoutId) {
        this.checkoutId = checkoutId;
    }

    public CheckoutStep getStep() {
        return step;
    }

    public void setStep(CheckoutStep step) {
        this.step = step;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public CheckoutTaskStatus getStatus() {
        return status;
    }

    public void setStatus(CheckoutTaskStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }
}
