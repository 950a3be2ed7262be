package com.example.identityapi.service;

import com.example.identityapi.dto.SearchPasswordHistoryRequest;
import com.example.identityapi.dto.StorePasswordHistoryRequest;
import com.example.identityapi.entity.PasswordHistory;
import com.example.identityapi.repository.PasswordHistoryRepository;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.time.Instant;
import java.util.List;

/**
 * Past password hashes of each user, used to refuse password reuse.
 */
@Service
public class PasswordHistoryService {

    private final PasswordHistoryRepository passwordHistoryRepository;
    private final PasswordHistoryCleanupService cleanupService;
    private final PasswordEncoder passwordEncoder;

    public PasswordHistoryService(PasswordHistoryRepository passwordHistoryRepository,
                                  PasswordHistoryCleanupService cleanupService,
                                  PasswordEncoder passwordEncoder) {
        this.passwordHistoryRepository = passwordHistoryRepository;
        this.cleanupService = cleanupService;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Record a new hash, then prune the user's history. The new row counts toward retention.
     */
    @Transactional
    public void addPasswordHistory(StorePasswordHistoryRequest request) {
        Assert.notNull(request, "request must not be null");
        Assert.hasText(request.userId(), "userId must not be empty");
        Assert.hasText(request.passwordHash(), "passwordHash must not be empty");

        passwordHistoryRepository.saveAndFlush(
                new PasswordHistory(request.userId(), request.passwordHash(), Instant.now()));
        cleanupService.removeOldPasswords(request.userId());
    }

    /**
     * @return true if the plaintext password verifies against any stored hash of the user
     */
    @Transactional(readOnly = true)
    public boolean findPasswordHash(SearchPasswordHistoryRequest request) {
        Assert.notNull(request, "request must not be null");
        Assert.hasText(request.userId(), "userId must not be empty");
        Assert.hasText(request.password(), "password must not be empty");

        List<String> hashes = passwordHistoryRepository.findPasswordHashesByUserId(request.userId());
        return hashes.stream().anyMatch(hash -> passwordEncoder.matches(request.password(), hash));
    }
}
