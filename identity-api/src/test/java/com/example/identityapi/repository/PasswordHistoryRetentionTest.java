package com.example.identityapi.repository;

import com.example.identityapi.config.PasswordHistoryProperties;
import com.example.identityapi.dto.SearchPasswordHistoryRequest;
import com.example.identityapi.dto.StorePasswordHistoryRequest;
import com.example.identityapi.entity.PasswordHistory;
import com.example.identityapi.service.PasswordHistoryCleanupService;
import com.example.identityapi.service.PasswordHistoryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.TestPropertySource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Password history retention against a real database.
 */
@DataJpaTest
@Import({PasswordHistoryService.class, PasswordHistoryCleanupService.class,
        PasswordHistoryRetentionTest.HistoryTestConfig.class})
@TestPropertySource(properties = "spring.flyway.enabled=false")
@DisplayName("Password history retention")
class PasswordHistoryRetentionTest {

    @TestConfiguration
    @EnableConfigurationProperties(PasswordHistoryProperties.class)
    static class HistoryTestConfig {

        @Bean
        PasswordEncoder passwordEncoder() {
            return new BCryptPasswordEncoder(4);
        }
    }

    @Autowired
    private PasswordHistoryService passwordHistoryService;

    @Autowired
    private PasswordHistoryCleanupService cleanupService;

    @Autowired
    private PasswordHistoryRepository passwordHistoryRepository;

    @Autowired
    private PasswordEncoder passwordEncoder;

    @Test
    @DisplayName("after seven writes only the five newest remain")
    void keepsFiveNewest() {
        for (int i = 1; i <= 7; i++) {
            passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u1", "hash-" + i));
        }

        List<String> remaining = passwordHistoryRepository.findByUserIdOrderByCreatedDateDescIdDesc("u1").stream()
                .map(PasswordHistory::getPasswordHash)
                .toList();

        assertEquals(List.of("hash-7", "hash-6", "hash-5", "hash-4", "hash-3"), remaining);
    }

    @Test
    @DisplayName("pruning one user leaves other users alone")
    void pruningIsPerUser() {
        passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u2", "other-hash"));
        for (int i = 1; i <= 6; i++) {
            passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u1", "hash-" + i));
        }

        assertEquals(5, passwordHistoryRepository.countByUserId("u1"));
        assertEquals(1, passwordHistoryRepository.countByUserId("u2"));
    }

    @Test
    @DisplayName("repeated cleanup without a new write changes nothing")
    void cleanupIsIdempotent() {
        for (int i = 1; i <= 6; i++) {
            passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u1", "hash-" + i));
        }
        List<PasswordHistory> before = passwordHistoryRepository.findByUserIdOrderByCreatedDateDescIdDesc("u1");

        cleanupService.removeOldPasswords("u1");
        cleanupService.removeOldPasswords("u1");

        List<PasswordHistory> after = passwordHistoryRepository.findByUserIdOrderByCreatedDateDescIdDesc("u1");
        assertEquals(before.stream().map(PasswordHistory::getId).toList(),
                after.stream().map(PasswordHistory::getId).toList());
    }

    @Test
    @DisplayName("account deletion erases the whole history of that user only")
    void deleteErasesHistory() {
        passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u1", "hash-1"));
        passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u1", "hash-2"));
        passwordHistoryService.addPasswordHistory(new StorePasswordHistoryRequest("u2", "hash-3"));

        cleanupService.deletePasswordHistory("u1");
        cleanupService.deletePasswordHistory("u1");

        assertEquals(0, passwordHistoryRepository.countByUserId("u1"));
        assertEquals(1, passwordHistoryRepository.countByUserId("u2"));
    }

    @Test
    @DisplayName("reuse detection only sees the retained window")
    void reuseDetectionUsesRetainedHashes() {
        for (int i = 1; i <= 6; i++) {
            passwordHistoryService.addPasswordHistory(
                    new StorePasswordHistoryRequest("u1", passwordEncoder.encode("Password@" + i)));
        }

        assertFalse(passwordHistoryService.findPasswordHash(new SearchPasswordHistoryRequest("u1", "Password@1")));
        assertTrue(passwordHistoryService.findPasswordHash(new SearchPasswordHistoryRequest("u1", "Password@2")));
        assertTrue(passwordHistoryService.findPasswordHash(new SearchPasswordHistoryRequest("u1", "Password@6")));
    }
}
