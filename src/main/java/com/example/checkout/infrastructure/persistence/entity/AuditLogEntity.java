package com.example.checkout.infrastructure.persistence.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Audit trail row. Never updated after insert.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_object", columnList = "model_name, object_id"),
    @Index(name = "idx_audit_action", columnList = "action")
})
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", length = 64, nullable = false, updatable = false)
    private String modelName;

    @Column(name = "object_id", length = 64, nullable = false, updatable = false)
    private String objectId;

    @Column(name = "action", length = 32, nullable = false, updatable = false)
    private String action;

    @Column(name = "field_name", length = 64, updatable = false)
    private String fieldName;

    @Column(name = "old_value", length = 500, updatable = false)
    private String oldValue;

    @Column(name = "new_value", length = 500, updatable = false)
    private String newValue;

    @Column(name = "actor_id", length = 36, updatable = false)
    private String actorId;

    @Column(name = "metadata", columnDefinition = "TEXT", updatable = false)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public Long getId() {
        return id;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public String getObjectId() {
        return objectId;
    }

    public void setObjectId(String objectId) {
        this.objectId = objectId;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getFieldName() {
        return fieldName;
    }

    public void setFieldName(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getOldValue() {
        return oldValue;
    }

    public void setOldValue(String oldValue) {
        this.oldValue = oldValue;
    }

    public String getNewValue() {
        return newValue;
    }

    public void setNewValue(String newValue) {
        this.newValue = newValue;
    }

    public String getActorId() {
        return actorId;
    }

    public void setActorId(String actorId) {
        this.actorId = actorId;
    }

    public String getMetadata() {
        return metadata;
    }

    public void setMetadata(String metadata) {
        this.metadata = metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
