package com.example.identityapi.service;

import com.example.identityapi.dto.SearchPasswordHistoryRequest;
import com.example.identityapi.dto.SetPasswordRequest;
import com.example.identityapi.dto.StorePasswordHistoryRequest;
import com.example.identityapi.dto.UpdatePasswordRequest;
import com.example.identityapi.entity.User;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.Optional;

/**
 * Password lifecycle of user accounts.
 *
 * Design Decisions:
 * 1. setPassword has no permission check: it is the activation path of accounts with no credentials yet
 * 2. updatePassword reports "user not found" and "no password set" as InvalidCredentials,
 *    so callers cannot discover which accounts exist
 * 3. Each operation runs in one transaction: verify → change → history insert → prune.
 *    Concurrent updates of the same user fail on the User version column.
 * 4. Exactly one history row is written on success, none on failure
 */
@Service
public class PasswordService {

    private static final Logger log = LoggerFactory.getLogger(PasswordService.class);

    private static final String OPERATION_UPDATE_PASSWORD = "UPDATE_PASSWORD";

    private final UserAccountManager userAccountManager;
    private final PermissionGate permissionGate;
    private final PasswordHistoryService passwordHistoryService;
    private final AuditService auditService;

    public PasswordService(UserAccountManager userAccountManager,
                           PermissionGate permissionGate,
                           PasswordHistoryService passwordHistoryService,
                           AuditService auditService) {
        this.userAccountManager = userAccountManager;
        this.permissionGate = permissionGate;
        this.passwordHistoryService = passwordHistoryService;
        this.auditService = auditService;
    }

    /**
     * Attach the first password to an account.
     *
     * @throws IllegalArgumentException if id or any request field is empty
     */
    @Transactional
    public ServiceResult<Void> setPassword(String id, SetPasswordRequest request) {
        Assert.hasText(id, "id must not be empty");
        Assert.notNull(request, "request must not be null");
        Assert.hasText(request.password(), "password must not be empty");
        Assert.hasText(request.passwordConfirmed(), "passwordConfirmed must not be empty");

        if (!request.password().equals(request.passwordConfirmed())) {
            return ServiceResult.failure(ServiceError.PASSWORD_MISMATCH);
        }

        Optional<User> found = userAccountManager.findById(id);
        if (found.isEmpty()) {
            return ServiceResult.failure(ServiceError.USER_NOT_FOUND);
        }

        User user = found.get();
        if (user.hasPassword()) {
            return ServiceResult.failure(ServiceError.PASSWORD_ALREADY_SET);
        }

        ServiceResult<Void> stored = userAccountManager.addPassword(user, request.password());
        if (!stored.isSuccess()) {
            log.info("Password of user {} rejected by store: {}", id, stored.errors());
            return stored;
        }

        passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest(id, user.getPasswordHash()));
        auditService.logPasswordSet(id, user.getUserName());
        log.info("Password set for user {}", id);
        return ServiceResult.success();
    }

    /**
     * Rotate the password of an account. The principal must be allowed to act on the account.
     *
     * @throws IllegalArgumentException if id or any request field is empty
     */
    @Transactional
    public ServiceResult<Void> updatePassword(ActingPrincipal principal, String id, UpdatePasswordRequest request) {
        Assert.hasText(id, "id must not be empty");
        Assert.notNull(request, "request must not be null");
        Assert.hasText(request.currentPassword(), "currentPassword must not be empty");
        Assert.hasText(request.newPassword(), "newPassword must not be empty");

        if (!permissionGate.checkPermission(principal, id, OPERATION_UPDATE_PASSWORD)) {
            return ServiceResult.failure(ServiceError.FORBIDDEN);
        }

        Optional<User> found = userAccountManager.findById(id);
        if (found.isEmpty() || !found.get().hasPassword()) {
            return ServiceResult.failure(ServiceError.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!userAccountManager.checkPassword(user, request.currentPassword())) {
            log.info("Password update of user {} rejected: current password does not match", id);
            return ServiceResult.failure(ServiceError.INVALID_CREDENTIALS);
        }

        if (passwordHistoryService.findPasswordHash(new SearchPasswordHistoryRequest(id, request.newPassword()))) {
            return ServiceResult.failure(ServiceError.CANNOT_REUSE);
        }

        ServiceResult<Void> changed = userAccountManager.changePassword(
                user, request.currentPassword(), request.newPassword());
        if (!changed.isSuccess()) {
            log.info("Password of user {} rejected by store: {}", id, changed.errors());
            return changed;
        }

        passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest(id, user.getPasswordHash()));
        auditService.logPasswordChange(principal, id);
        log.info("Password updated for user {}", id);
        return ServiceResult.success();
    }
}
