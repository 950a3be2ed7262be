package com.example.identityapi.service;

import com.example.identityapi.entity.Role;
import com.example.identityapi.entity.User;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.security.ActingPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Decides whether an acting principal may operate on a target user.
 *
 * Rules, in order:
 * 1. No principal or no principal id: denied (checked before the target id)
 * 2. Empty target id: denied
 * 3. Self access: allowed for every role, whether or not the target exists
 * 4. Unknown target: denied
 * 5. Principal without roles: denied
 * 6. SuperAdmin: allowed on anyone, other SuperAdmins included
 * 7. Otherwise the principal's highest role must strictly outrank every role of the target.
 *    A target without roles ranks as User.
 *
 * Read-only. Denials are returned, never thrown.
 */
@Service
public class PermissionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PermissionEvaluator.class);

    private final UserRepository userRepository;

    public PermissionEvaluator(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public boolean validatePermission(ActingPrincipal principal, String targetUserId) {
        if (principal == null || !StringUtils.hasText(principal.userId())) {
            log.debug("Permission denied: no authenticated principal");
            return false;
        }

        if (!StringUtils.hasText(targetUserId)) {
            return false;
        }

        if (principal.userId().equals(targetUserId)) {
            return true;
        }

        Optional<User> target = userRepository.findById(targetUserId);
        if (target.isEmpty()) {
            log.debug("Permission denied: target user {} not found", targetUserId);
            return false;
        }

        Optional<Role> actingRole = principal.highestRole();
        if (actingRole.isEmpty()) {
            log.debug("Permission denied: principal {} holds no role", principal.userId());
            return false;
        }

        if (actingRole.get() == Role.SUPER_ADMIN) {
            return true;
        }

        Role targetRole = target.get().getHighestRole().orElse(Role.USER);
        boolean granted = actingRole.get().outranks(targetRole);
        if (!granted) {
            log.debug("Permission denied: {} does not outrank {} of user {}", actingRole.get(), targetRole, targetUserId);
        }
        return granted;
    }
}
