package com.example.checkout.infrastructure.persistence;

import com.example.checkout.application.port.out.AuditPort;
import com.example.checkout.infrastructure.persistence.entity.AuditLogEntity;
import com.example.checkout.infrastructure.persistence.repository.AuditLogJpaRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends audit rows in the caller's transaction.
 */
@Component
public class AuditLogAdapter implements AuditPort {

    private static final Logger log = LoggerFactory.getLogger(AuditLogAdapter.class);

    private final AuditLogJpaRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditLogAdapter(AuditLogJpaRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditEntry entry) {
        AuditLogEntity entity = new AuditLogEntity();
        entity.setModelName(entry.modelName());
        entity.setObjectId(entry.objectId());
        entity.setAction(entry.action().wireValue());
        entity.setFieldName(entry.field());
        entity.setOldValue(entry.oldValue());
        entity.setNewValue(entry.newValue());
        entity.setActorId(entry.actorId());
        entity.setMetadata(serialize(entry));
        auditLogRepository.save(entity);

        log.debug("Audit {} {}#{} {}: {} -> {}", entry.action().wireValue(), entry.modelName(),
                entry.objectId(), entry.field(), entry.oldValue(), entry.newValue());
    }

    private String serialize(AuditEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit metadata for " + entry.objectId(), e);
        }
    }
}
