package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.CartItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface CartItemJpaRepository extends JpaRepository<CartItemEntity, Long> {

    long countByCartId(UUID cartId);
}
