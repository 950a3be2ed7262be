package com.example.identityapi.service;

import com.example.identityapi.TestUsers;
import com.example.identityapi.config.PasswordPolicyProperties;
import com.example.identityapi.entity.User;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserAccountManagerTest {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    @Mock
    private UserRepository userRepository;

    private UserAccountManager manager;

    @BeforeEach
    void setUp() {
        manager = new UserAccountManager(userRepository, passwordEncoder,
                new PasswordPolicyValidator(new PasswordPolicyProperties()), VALIDATOR);
    }

    @Test
    @DisplayName("first password is hashed and stored")
    void addPassword() {
        User user = TestUsers.user("u1");

        ServiceResult<Void> result = manager.addPassword(user, "Secret#123");

        assertTrue(result.isSuccess());
        assertTrue(passwordEncoder.matches("Secret#123", user.getPasswordHash()));
        verify(userRepository).saveAndFlush(user);
    }

    @Test
    @DisplayName("weak password is refused with every policy message")
    void addWeakPassword() {
        User user = TestUsers.user("u1");

        ServiceResult<Void> result = manager.addPassword(user, "secret");

        assertTrue(result.hasError(ServiceError.STORE_FAILURE));
        assertEquals(4, result.errors().size());
        assertNull(user.getPasswordHash());
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    void changePasswordRequiresTheCurrentOne() {
        User user = TestUsers.user("u1");
        user.setPasswordHash(passwordEncoder.encode("Secret#123"));

        ServiceResult<Void> result = manager.changePassword(user, "Wrong#123", "Better#456");

        assertEquals(List.of("Incorrect password."), result.errors());
    }

    @Test
    void changePassword() {
        User user = TestUsers.user("u1");
        user.setPasswordHash(passwordEncoder.encode("Secret#123"));

        ServiceResult<Void> result = manager.changePassword(user, "Secret#123", "Better#456");

        assertTrue(result.isSuccess());
        assertTrue(manager.checkPassword(user, "Better#456"));
    }

    @Test
    void checkPasswordWithoutStoredHash() {
        assertFalse(manager.checkPassword(TestUsers.user("u1"), "Secret#123"));
    }

    @Test
    @DisplayName("duplicate user name and email are both reported")
    void createWithDuplicates() {
        User user = TestUsers.user("u1");
        user.setId(null);
        when(userRepository.existsByUserName(user.getUserName())).thenReturn(true);
        when(userRepository.existsByEmail(user.getEmail())).thenReturn(true);

        ServiceResult<User> result = manager.create(user);

        assertTrue(result.hasError(ServiceError.STORE_FAILURE));
        assertEquals(2, result.errors().size());
    }

    @Test
    void updateIgnoresTheAccountItself() {
        User user = TestUsers.user("u1");
        when(userRepository.existsByUserNameAndIdNot(user.getUserName(), "u1")).thenReturn(false);
        when(userRepository.existsByEmailAndIdNot(user.getEmail(), "u1")).thenReturn(false);

        assertTrue(manager.update(user).isSuccess());
        verify(userRepository).saveAndFlush(user);
    }

    @Test
    @DisplayName("values the columns cannot hold are refused before any write")
    void createWithOversizedFields() {
        User user = TestUsers.user("u1");
        user.setId(null);
        user.setPhoneNumber("1".repeat(40));
        user.setEmail("not-an-email");

        ServiceResult<User> result = manager.create(user);

        assertTrue(result.hasError(ServiceError.STORE_FAILURE));
        assertEquals(List.of("Email is invalid.", "Phone number must not exceed 30 characters."), result.errors());
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateRefusesBlankLastName() {
        User user = TestUsers.user("u1");
        user.setLastName(" ");

        ServiceResult<Void> result = manager.update(user);

        assertEquals(List.of("Last name is required."), result.errors());
        verify(userRepository, never()).existsByUserNameAndIdNot(any(), any());
    }

    @Test
    void deleteFlushesImmediately() {
        User user = TestUsers.user("u1");

        assertTrue(manager.delete(user).isSuccess());
        verify(userRepository).delete(user);
        verify(userRepository).flush();
    }
}
