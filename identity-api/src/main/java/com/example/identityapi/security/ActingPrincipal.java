package com.example.identityapi.security;

import com.example.identityapi.entity.Role;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Authenticated actor of a request: the user id and roles taken from the access token.
 * Passed explicitly to every permission-gated operation.
 */
public record ActingPrincipal(String userId, String userName, Set<Role> roles) {

    public ActingPrincipal {
        roles = roles == null || roles.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(roles));
    }

    public static ActingPrincipal of(String userId, Role... roles) {
        return new ActingPrincipal(userId, null, roles.length == 0 ? Set.of() : EnumSet.copyOf(Arrays.asList(roles)));
    }

    /**
     * Role used for rank comparison when several role claims are present.
     */
    public Optional<Role> highestRole() {
        return roles.stream().max(Enum::compareTo);
    }
}
