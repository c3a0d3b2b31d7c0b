package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.application.pipeline.CheckoutStep;
import com.example.checkout.infrastructure.persistence.entity.CheckoutTaskEntity;
import com.example.checkout.infrastructure.persistence.entity.CheckoutTaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA Repository for queued pipeline steps.
 */
@Repository
public interface CheckoutTaskRepository extends JpaRepository<CheckoutTaskEntity, String> {

    @Query("SELECT t.id FROM CheckoutTaskEntity t WHERE t.status = :status AND t.nextAttemptAt <= :now "
            + "ORDER BY t.nextAttemptAt ASC LIMIT :limit")
    List<String> findDueTaskIds(@Param("status") CheckoutTaskStatus status,
                                @Param("now") Instant now,
                                @Param("limit") int limit);

    /**
     * Moves a task from {@code expected} to {@code target} only if no other worker got there first.
     */
    @Modifying
    @Query("UPDATE CheckoutTaskEntity t SET t.status = :target, t.attempts = t.attempts + 1, t.lockedAt = :now "
            + "WHERE t.id = :id AND t.status = :expected")
    int claim(@Param("id") String id,
              @Param("now") Instant now,
              @Param("expected") CheckoutTaskStatus expected,
              @Param("target") CheckoutTaskStatus target);

    @Modifying
    @Query("UPDATE CheckoutTaskEntity t SET t.status = :target, t.attempts = t.attempts - 1, t.lockedAt = NULL "
            + "WHERE t.id = :id AND t.status = :expected")
    int unclaim(@Param("id") String id,
                @Param("expected") CheckoutTaskStatus expected,
                @Param("target") CheckoutTaskStatus target);

    @Modifying
    @Query("UPDATE CheckoutTaskEntity t SET t.status = :target, t.lockedAt = NULL "
            + "WHERE t.status = :expected AND t.lockedAt < :cutoff")
    int releaseStale(@Param("cutoff") Instant cutoff,
                     @Param("expected") CheckoutTaskStatus expected,
                     @Param("target") CheckoutTaskStatus target);

    @Modifying
    @Query("DELETE FROM CheckoutTaskEntity t WHERE t.status = :status AND t.processedAt < :before")
    int deleteFinishedBefore(@Param("status") CheckoutTaskStatus status, @Param("before") Instant before);

    boolean existsByCheckoutIdAndStep(UUID checkoutId, CheckoutStep step);

    long countByStatus(CheckoutTaskStatus status);

    List<CheckoutTaskEntity> findByCheckoutIdOrderByCreatedAtAsc(UUID checkoutId);
}
