package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.domain.model.CheckoutStatus;
import com.example.checkout.infrastructure.persistence.entity.CheckoutAttemptEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA Repository for checkout attempts.
 */
@Repository
public interface CheckoutAttemptRepository extends JpaRepository<CheckoutAttemptEntity, UUID> {

    Optional<CheckoutAttemptEntity> findByIdempotencyKey(String idempotencyKey);

    boolean existsByCartIdAndStatusIn(UUID cartId, Collection<CheckoutStatus> statuses);

    @Modifying
    @Query("DELETE FROM CheckoutAttemptEntity a WHERE a.expiresAt < :now AND a.status IN :statuses")
    int deleteExpired(@Param("now") Instant now, @Param("statuses") Collection<CheckoutStatus> statuses);
}
