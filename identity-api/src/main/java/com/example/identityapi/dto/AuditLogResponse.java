package com.example.identityapi.dto;

import com.example.identityapi.entity.AuditLog;
import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;

/**
 * Audit log entry as returned to administrators.
 */
public record AuditLogResponse(
    Long id,
    String entityType,
    String entityId,
    String action,
    String outcome,
    String actorId,
    String actorName,
    String ipAddress,
    String userAgent,
    String oldValue,
    String newValue,
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdAt
) {
    public static AuditLogResponse from(AuditLog log) {
        return new AuditLogResponse(
            log.getId(),
            log.getEntityType(),
            log.getEntityId(),
            log.getAction().name(),
            log.getOutcome().name(),
            log.getActorId(),
            log.getActorName(),
            log.getIpAddress(),
            log.getUserAgent(),
            log.getOldValue(),
            log.getNewValue(),
            log.getCreatedAt()
        );
    }
}
