package com.example.checkout.infrastructure.persistence.repository;

import com.example.checkout.infrastructure.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogJpaRepository extends JpaRepository<AuditLogEntity, Long> {

    List<AuditLogEntity> findByModelNameAndObjectIdOrderByIdAsc(String modelName, String objectId);

    List<AuditLogEntity> findByObjectIdAndActionOrderByIdAsc(String objectId, String action);
}
