package com.example.identityapi.service;

import com.example.identityapi.TestUsers;
import com.example.identityapi.entity.Role;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.security.ActingPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PermissionEvaluator")
class PermissionEvaluatorTest {

    @Mock
    private UserRepository userRepository;

    private PermissionEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new PermissionEvaluator(userRepository);
    }

    @Test
    @DisplayName("no principal is denied before the target id is looked at")
    void nullPrincipalIsDenied() {
        assertFalse(evaluator.validatePermission(null, "target"));
        assertFalse(evaluator.validatePermission(null, null));
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("principal without id is denied")
    void principalWithoutIdIsDenied() {
        ActingPrincipal principal = new ActingPrincipal(null, null, Set.of(Role.SUPER_ADMIN));

        assertFalse(evaluator.validatePermission(principal, "target"));
        verifyNoInteractions(userRepository);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @DisplayName("empty target id is denied")
    void emptyTargetIsDenied(String targetId) {
        assertFalse(evaluator.validatePermission(ActingPrincipal.of("actor", Role.SUPER_ADMIN), targetId));
        verifyNoInteractions(userRepository);
    }

    @ParameterizedTest
    @EnumSource(Role.class)
    @DisplayName("self access is allowed for every role without a lookup")
    void selfAccessIsAllowedForEveryRole(Role role) {
        assertTrue(evaluator.validatePermission(ActingPrincipal.of("u1", role), "u1"));
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("self access is allowed without any role, even for an unknown id")
    void selfAccessWithoutRoleIsAllowed() {
        assertTrue(evaluator.validatePermission(ActingPrincipal.of("nonexistent"), "nonexistent"));
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("unknown target is denied")
    void unknownTargetIsDenied() {
        when(userRepository.findById("ghost")).thenReturn(Optional.empty());

        assertFalse(evaluator.validatePermission(ActingPrincipal.of("actor", Role.SUPER_ADMIN), "ghost"));
    }

    @Test
    @DisplayName("principal without role is denied on others")
    void roleLessPrincipalIsDenied() {
        when(userRepository.findById("target")).thenReturn(Optional.of(TestUsers.user("target", Role.USER)));

        assertFalse(evaluator.validatePermission(ActingPrincipal.of("actor"), "target"));
    }

    @ParameterizedTest(name = "{0} acting on {1} -> {2}")
    @CsvSource({
            "USER,        USER,        false",
            "USER,        ADMIN,       false",
            "USER,        SUPER_ADMIN, false",
            "ADMIN,       USER,        true",
            "ADMIN,       ADMIN,       false",
            "ADMIN,       SUPER_ADMIN, false",
            "SUPER_ADMIN, USER,        true",
            "SUPER_ADMIN, ADMIN,       true",
            "SUPER_ADMIN, SUPER_ADMIN, true"
    })
    @DisplayName("role hierarchy on other users")
    void roleHierarchy(Role acting, Role target, boolean expected) {
        when(userRepository.findById("target")).thenReturn(Optional.of(TestUsers.user("target", target)));

        assertEquals(expected, evaluator.validatePermission(ActingPrincipal.of("actor", acting), "target"));
    }

    @Test
    @DisplayName("target without role ranks as User")
    void roleLessTargetRanksAsUser() {
        when(userRepository.findById("target")).thenReturn(Optional.of(TestUsers.user("target")));

        assertTrue(evaluator.validatePermission(ActingPrincipal.of("actor", Role.ADMIN), "target"));
        assertFalse(evaluator.validatePermission(ActingPrincipal.of("actor", Role.USER), "target"));
    }

    @Test
    @DisplayName("every target role must be outranked")
    void everyTargetRoleMustBeOutranked() {
        when(userRepository.findById("target"))
                .thenReturn(Optional.of(TestUsers.user("target", Role.USER, Role.ADMIN)));

        assertFalse(evaluator.validatePermission(ActingPrincipal.of("actor", Role.ADMIN), "target"));
    }

    @Test
    @DisplayName("highest role of the principal is compared")
    void highestPrincipalRoleIsCompared() {
        when(userRepository.findById("target")).thenReturn(Optional.of(TestUsers.user("target", Role.USER)));
        ActingPrincipal principal = new ActingPrincipal("actor", "actor", EnumSet.of(Role.USER, Role.ADMIN));

        assertTrue(evaluator.validatePermission(principal, "target"));
    }
}
