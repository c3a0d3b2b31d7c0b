package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.OrderEntity;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") String id);

    Optional<OrderEntity> findByCheckoutId(UUID checkoutId);

    boolean existsByOrderNumber(String orderNumber);

    List<OrderEntity> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);
}
