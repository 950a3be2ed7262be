package com.example.identityapi.service;

import com.example.identityapi.entity.User;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.util.function.Function;

/**
 * Shared template of every sensitive user mutation:
 * argument check → permission check (Forbidden) → target lookup (UserNotFound) → operation.
 *
 * The operation receives the loaded user and applies its own precondition and change.
 * Runs inside the caller's transaction.
 */
@Component
public class PermissionGate {

    private static final Logger log = LoggerFactory.getLogger(PermissionGate.class);

    private final PermissionEvaluator permissionEvaluator;
    private final UserRepository userRepository;
    private final AuditService auditService;

    public PermissionGate(PermissionEvaluator permissionEvaluator,
                          UserRepository userRepository,
                          AuditService auditService) {
        this.permissionEvaluator = permissionEvaluator;
        this.userRepository = userRepository;
        this.auditService = auditService;
    }

    /**
     * @param principal acting principal, may be null (denied)
     * @param targetUserId id of the user the operation applies to
     * @param operation operation name recorded on denial
     * @param action the mutation, given the loaded target
     * @throws IllegalArgumentException if targetUserId is empty or action is null
     */
    public <T> ServiceResult<T> execute(ActingPrincipal principal,
                                        String targetUserId,
                                        String operation,
                                        Function<User, ServiceResult<T>> action) {
        Assert.hasText(targetUserId, "id must not be empty");
        Assert.notNull(action, "action must not be null");

        if (!checkPermission(principal, targetUserId, operation)) {
            return ServiceResult.failure(ServiceError.FORBIDDEN);
        }

        return userRepository.findById(targetUserId)
                .map(action)
                .orElseGet(() -> ServiceResult.failure(ServiceError.USER_NOT_FOUND));
    }

    /**
     * Permission check alone, with the denial recorded. For operations that do their own lookup.
     */
    public boolean checkPermission(ActingPrincipal principal, String targetUserId, String operation) {
        if (permissionEvaluator.validatePermission(principal, targetUserId)) {
            return true;
        }
        log.warn("{} on user {} denied for {}", operation, targetUserId,
                principal != null ? principal.userId() : "anonymous");
        auditService.logPermissionDenied(principal, targetUserId, operation);
        return false;
    }
}
