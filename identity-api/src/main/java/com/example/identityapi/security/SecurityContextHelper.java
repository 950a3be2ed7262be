package com.example.identityapi.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Helper class to extract current principal from SecurityContext.
 *
 * - Returns Optional to handle anonymous requests gracefully
 * - Used by controllers to pass the acting principal explicitly to services
 */
@Component
public class SecurityContextHelper {

    /**
     * Get current authenticated principal.
     * @return Optional<ActingPrincipal> - empty if not authenticated
     */
    public Optional<ActingPrincipal> getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof ActingPrincipal principal) {
            return Optional.of(principal);
        }

        return Optional.empty();
    }
}
