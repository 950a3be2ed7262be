package com.example.identityapi.service;

import com.example.identityapi.config.PasswordHistoryProperties;
import com.example.identityapi.entity.PasswordHistory;
import com.example.identityapi.repository.PasswordHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.List;

/**
 * Retention of password history rows.
 *
 * Both operations reject an empty user id before touching the store.
 * Nothing to delete is a normal outcome, not an error.
 */
@Service
public class PasswordHistoryCleanupService {

    private static final Logger log = LoggerFactory.getLogger(PasswordHistoryCleanupService.class);

    private final PasswordHistoryRepository passwordHistoryRepository;
    private final int retention;

    public PasswordHistoryCleanupService(PasswordHistoryRepository passwordHistoryRepository,
                                         PasswordHistoryProperties properties) {
        Assert.isTrue(properties.getRetention() > 0, "identity.password-history.retention must be positive");
        this.passwordHistoryRepository = passwordHistoryRepository;
        this.retention = properties.getRetention();
    }

    /**
     * Keep only the newest entries of a user (by creation time, then id) and delete the rest.
     */
    @Transactional
    public void removeOldPasswords(String userId) {
        Assert.hasText(userId, "userId must not be empty");

        List<PasswordHistory> history = passwordHistoryRepository.findByUserIdOrderByCreatedDateDescIdDesc(userId);
        if (history.size() <= retention) {
            return;
        }

        List<PasswordHistory> stale = history.subList(retention, history.size());
        passwordHistoryRepository.deleteAll(stale);
        log.debug("Pruned {} password history entries of user {}", stale.size(), userId);
    }

    /**
     * Delete every history entry of a user. Used when the account is deleted.
     */
    @Transactional
    public void deletePasswordHistory(String userId) {
        Assert.hasText(userId, "userId must not be empty");

        int deleted = passwordHistoryRepository.deleteAllByUserId(userId);
        log.debug("Deleted {} password history entries of user {}", deleted, userId);
    }
}
