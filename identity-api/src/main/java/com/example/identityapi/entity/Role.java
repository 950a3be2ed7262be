package com.example.identityapi.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * User roles for authorization, declared from lowest to highest rank.
 *
 * Used in JWT claims and @PreAuthorize annotations
 * Spring Security automatically prefixes with "ROLE_"
 */
public enum Role {
    /**
     * Regular user - can only manage own account
     */
    USER("User"),

    /**
     * Administrator - can manage regular users
     */
    ADMIN("Admin"),

    /**
     * Super administrator - can manage every account, including other super admins
     */
    SUPER_ADMIN("SuperAdmin");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean outranks(Role other) {
        return this.ordinal() > other.ordinal();
    }

    /**
     * Resolve a role from either its constant name ("SUPER_ADMIN") or its
     * display name ("SuperAdmin"), ignoring case.
     */
    public static Optional<Role> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(role -> role.name().equalsIgnoreCase(trimmed)
                        || role.displayName.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
