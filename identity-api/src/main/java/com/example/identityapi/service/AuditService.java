package com.example.identityapi.service;

import com.example.identityapi.dto.UserAuditDto;
import com.example.identityapi.entity.AuditAction;
import com.example.identityapi.entity.AuditLog;
import com.example.identityapi.entity.Role;
import com.example.identityapi.repository.AuditLogRepository;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.security.CorrelationIdFilter;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.Map;

/**
 * Service for creating and reading audit logs.
 *
 * Design Decisions:
 * 1. @Async: Audit logging is non-blocking to not slow down main operations
 * 2. REQUIRES_NEW: Audit logs are persisted even if main transaction rolls back
 * 3. Graceful degradation: Failures in audit logging don't affect main operations
 * 4. UserAuditDto: Excludes passwordHash to prevent sensitive data leakage
 * 5. Snapshots of the user are taken on the calling thread, before the entity changes again
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private static final String ENTITY_USER = "USER";
    private static final String ANONYMOUS = "ANONYMOUS";

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    public AuditService(AuditLogRepository auditLogRepository, ObjectMapper objectMapper) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
    }

    // ==================== Authentication Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginSuccess(String userId, String userName) {
        createAuditLog(ENTITY_USER, userId, AuditAction.LOGIN_SUCCESS, userId, userName,
                AuditLog.AuditOutcome.SUCCESS, null, null);
    }

    /**
     * Log failed login attempt (unknown user or wrong password).
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginFailure(String userName, String reason) {
        createAuditLog(ENTITY_USER, null, AuditAction.LOGIN_FAILED, null, userName,
                AuditLog.AuditOutcome.FAILURE, null, reason);
    }

    /**
     * Log login denied (account not activated).
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logLoginDenied(String userId, String userName, String reason) {
        createAuditLog(ENTITY_USER, userId, AuditAction.LOGIN_DENIED, userId, userName,
                AuditLog.AuditOutcome.DENIED, null, reason);
    }

    // ==================== Password Audit ====================

    /**
     * First password of an account. Anonymous endpoint, the account itself is recorded as actor.
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordSet(String userId, String userName) {
        createAuditLog(ENTITY_USER, userId, AuditAction.PASSWORD_SET, userId, userName,
                AuditLog.AuditOutcome.SUCCESS, null, null);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPasswordChange(ActingPrincipal actor, String userId) {
        createAuditLog(ENTITY_USER, userId, AuditAction.PASSWORD_CHANGE, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, null, null);
    }

    // ==================== User Lifecycle Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logUserCreated(UserAuditDto created) {
        createAuditLog(ENTITY_USER, created.id(), AuditAction.CREATE, null, ANONYMOUS,
                AuditLog.AuditOutcome.SUCCESS, null, toJson(created));
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logUserUpdated(ActingPrincipal actor, UserAuditDto before, UserAuditDto after) {
        createAuditLog(ENTITY_USER, after.id(), AuditAction.UPDATE, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, toJson(before), toJson(after));
    }

    /**
     * old_value = state before delete
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logUserDeleted(ActingPrincipal actor, UserAuditDto deleted) {
        createAuditLog(ENTITY_USER, deleted.id(), AuditAction.DELETE, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, toJson(deleted), null);
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logAccountActivated(ActingPrincipal actor, String userId) {
        createAuditLog(ENTITY_USER, userId, AuditAction.ACCOUNT_ACTIVATED, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, "{\"status\":\"INACTIVE\"}", "{\"status\":\"ACTIVE\"}");
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logAccountDeactivated(ActingPrincipal actor, String userId) {
        createAuditLog(ENTITY_USER, userId, AuditAction.ACCOUNT_DEACTIVATED, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, "{\"status\":\"ACTIVE\"}", "{\"status\":\"INACTIVE\"}");
    }

    // ==================== Authorization Audit ====================

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRoleAssigned(ActingPrincipal actor, String userId, Role role) {
        createAuditLog(ENTITY_USER, userId, AuditAction.ROLE_ASSIGNED, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, null, toJson(Map.of("role", role.getDisplayName())));
    }

    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logRoleRemoved(ActingPrincipal actor, String userId, Role role) {
        createAuditLog(ENTITY_USER, userId, AuditAction.ROLE_REMOVED, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.SUCCESS, toJson(Map.of("role", role.getDisplayName())), null);
    }

    /**
     * Log a rejected permission check on a target user.
     *
     * @param operation name of the attempted operation, e.g. "DELETE_USER"
     */
    @Async
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void logPermissionDenied(ActingPrincipal actor, String targetUserId, String operation) {
        createAuditLog(ENTITY_USER, targetUserId, AuditAction.PERMISSION_DENIED, actorId(actor), actorName(actor),
                AuditLog.AuditOutcome.DENIED, null, toJson(Map.of("operation", operation)));
    }

    // ==================== Queries ====================

    /**
     * Page through audit logs, newest first.
     *
     * @param action optional filter
     * @param page 1-based page number
     * @param size page size
     */
    @Transactional(readOnly = true)
    public Page<AuditLog> getLogs(AuditAction action, int page, int size) {
        Assert.isTrue(page >= 1, "page must be at least 1");
        Assert.isTrue(size >= 1, "size must be at least 1");

        Pageable pageable = PageRequest.of(page - 1, size, Sort.by(Sort.Direction.DESC, "createdAt", "id"));
        return action != null
                ? auditLogRepository.findByAction(action, pageable)
                : auditLogRepository.findAll(pageable);
    }

    @Transactional
    public ServiceResult<Void> deleteLog(Long id) {
        Assert.notNull(id, "id must not be null");

        if (!auditLogRepository.existsById(id)) {
            return ServiceResult.failure(ServiceError.AUDIT_LOG_NOT_FOUND);
        }
        auditLogRepository.deleteById(id);
        log.info("Audit log {} deleted", id);
        return ServiceResult.success();
    }

    // ==================== Internal ====================

    private void createAuditLog(
            String entityType,
            String entityId,
            AuditAction action,
            String actorId,
            String actorName,
            AuditLog.AuditOutcome outcome,
            String oldValue,
            String newValue) {

        try {
            AuditLog auditLog = AuditLog.builder()
                    .entityType(entityType)
                    .entityId(entityId)
                    .action(action)
                    .actorId(actorId)
                    .actorName(actorName)
                    .outcome(outcome)
                    .oldValue(oldValue)
                    .newValue(newValue)
                    // Copied from the request thread by AsyncConfig
                    .ipAddress(MDC.get(CorrelationIdFilter.MDC_CLIENT_IP))
                    .userAgent(truncate(MDC.get(CorrelationIdFilter.MDC_USER_AGENT), 500))
                    .build();

            auditLogRepository.save(auditLog);

            log.debug("Audit log created: {} {} on {}:{}", action, outcome, entityType, entityId);

        } catch (Exception e) {
            // Graceful degradation: log error but don't fail the main operation
            log.error("Failed to create audit log: {} {} on {}:{}", action, outcome, entityType, entityId, e);
        }
    }

    private String actorId(ActingPrincipal actor) {
        return actor != null ? actor.userId() : null;
    }

    private String actorName(ActingPrincipal actor) {
        if (actor == null) {
            return ANONYMOUS;
        }
        return actor.userName() != null ? actor.userName() : actor.userId();
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }

    private String toJson(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize object to JSON", e);
            return null;
        }
    }
}
