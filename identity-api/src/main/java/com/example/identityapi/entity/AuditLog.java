package com.example.identityapi.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Audit Log entity for tracking security-sensitive operations.
 *
 * - actor_name stored denormalized so reads need no join
 * - old_value/new_value stored as JSON text
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_entity", columnList = "entity_type, entity_id"),
    @Index(name = "idx_audit_actor", columnList = "actor_id"),
    @Index(name = "idx_audit_action", columnList = "action"),
    @Index(name = "idx_audit_created_at", columnList = "created_at")
})
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // What was changed
    @Column(name = "entity_type", nullable = false, length = 100)
    private String entityType;

    @Column(name = "entity_id", length = 36)
    private String entityId;

    // What action was performed
    @Column(nullable = false, length = 50)
    @Enumerated(EnumType.STRING)
    private AuditAction action;

    // Who performed the action (NULL for anonymous actions)
    @Column(name = "actor_id", length = 36)
    private String actorId;

    @Column(name = "actor_name", length = 255)
    private String actorName;

    // When
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Request context
    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;

    // Change details (JSON)
    @Column(name = "old_value", columnDefinition = "TEXT")
    private String oldValue;

    @Column(name = "new_value", columnDefinition = "TEXT")
    private String newValue;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private AuditOutcome outcome = AuditOutcome.SUCCESS;

    public enum AuditOutcome {
        SUCCESS,
        FAILURE,  // e.g. wrong password
        DENIED    // e.g. inactive account, insufficient rank
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = LocalDateTime.now();
    }

    protected AuditLog() {
    }

    private AuditLog(Builder builder) {
        this.entityType = builder.entityType;
        this.entityId = builder.entityId;
        this.action = builder.action;
        this.actorId = builder.actorId;
        this.actorName = builder.actorName;
        this.ipAddress = builder.ipAddress;
        this.userAgent = builder.userAgent;
        this.oldValue = builder.oldValue;
        this.newValue = builder.newValue;
        this.outcome = builder.outcome;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String entityType;
        private String entityId;
        private AuditAction action;
        private String actorId;
        private String actorName;
        private String ipAddress;
        private String userAgent;
        private String oldValue;
        private String newValue;
        private AuditOutcome outcome = AuditOutcome.SUCCESS;

        public Builder entityType(String entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        public Builder actorName(String actorName) {
            this.actorName = actorName;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder oldValue(String oldValue) {
            this.oldValue = oldValue;
            return this;
        }

        public Builder newValue(String newValue) {
            this.newValue = newValue;
            return this;
        }

        public Builder outcome(AuditOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public AuditLog build() {
            return new AuditLog(this);
        }
    }

    // Getters only (immutable)
    public Long getId() { return id; }
    public String getEntityType() { return entityType; }
    public String getEntityId() { return entityId; }
    public AuditAction getAction() { return action; }
    public String getActorId() { return actorId; }
    public String getActorName() { return actorName; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public String getIpAddress() { return ipAddress; }
    public String getUserAgent() { return userAgent; }
    public String getOldValue() { return oldValue; }
    public String getNewValue() { return newValue; }
    public AuditOutcome getOutcome() { return outcome; }
}
