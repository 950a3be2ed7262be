package com.example.identityapi.service;

import com.example.identityapi.entity.Role;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Role membership of user accounts.
 *
 * An account holds at most one role: assignment is refused while any role is held.
 */
@Service
public class RoleService {

    private static final Logger log = LoggerFactory.getLogger(RoleService.class);

    private final PermissionGate permissionGate;
    private final UserAccountManager userAccountManager;
    private final AuditService auditService;

    public RoleService(PermissionGate permissionGate,
                       UserAccountManager userAccountManager,
                       AuditService auditService) {
        this.permissionGate = permissionGate;
        this.userAccountManager = userAccountManager;
        this.auditService = auditService;
    }

    public List<Role> getRoles() {
        return Arrays.asList(Role.values());
    }

    @Transactional
    public ServiceResult<Void> assignRole(ActingPrincipal principal, String id, String roleName) {
        Assert.hasText(id, "id must not be empty");
        Assert.hasText(roleName, "roleName must not be empty");

        return permissionGate.execute(principal, id, "ASSIGN_ROLE", user -> {
            if (!user.isActive()) {
                return ServiceResult.failure(ServiceError.INACTIVE_USER);
            }

            Optional<Role> role = Role.fromName(roleName);
            if (role.isEmpty()) {
                return ServiceResult.failure(ServiceError.INVALID_ROLE);
            }

            if (!user.getRoles().isEmpty()) {
                return ServiceResult.failure(ServiceError.USER_ALREADY_HAS_ROLE);
            }

            user.getRoles().add(role.get());
            ServiceResult<Void> updated = userAccountManager.update(user);
            if (updated.isSuccess()) {
                auditService.logRoleAssigned(principal, id, role.get());
                log.info("Role {} assigned to user {}", role.get(), id);
            }
            return updated;
        });
    }

    @Transactional
    public ServiceResult<Void> removeRole(ActingPrincipal principal, String id, String roleName) {
        Assert.hasText(id, "id must not be empty");
        Assert.hasText(roleName, "roleName must not be empty");

        return permissionGate.execute(principal, id, "REMOVE_ROLE", user -> {
            Optional<Role> role = Role.fromName(roleName);
            if (role.isEmpty()) {
                return ServiceResult.failure(ServiceError.INVALID_ROLE);
            }

            if (!user.hasRole(role.get())) {
                return ServiceResult.failure(ServiceError.MISSING_ROLE);
            }

            user.getRoles().remove(role.get());
            ServiceResult<Void> updated = userAccountManager.update(user);
            if (updated.isSuccess()) {
                auditService.logRoleRemoved(principal, id, role.get());
                log.info("Role {} removed from user {}", role.get(), id);
            }
            return updated;
        });
    }
}
