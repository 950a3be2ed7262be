package com.example.identityapi.service;

import com.example.identityapi.entity.User;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.interceptor.TransactionAspectSupport;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Store-level operations on user accounts: lookup, credential writes and persistence.
 *
 * Write failures (password policy violations, field constraint violations, duplicate user
 * name or email) come back as {@link ServiceError#STORE_FAILURE} carrying every message.
 * They are all detected before the write: a statement the database rejects marks the
 * caller's transaction rollback-only, so it cannot be turned into a result here.
 * Business rules belong to the calling services.
 */
@Service
public class UserAccountManager {

    private static final Logger log = LoggerFactory.getLogger(UserAccountManager.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicyValidator passwordPolicyValidator;
    private final Validator validator;

    public UserAccountManager(UserRepository userRepository,
                              PasswordEncoder passwordEncoder,
                              PasswordPolicyValidator passwordPolicyValidator,
                              Validator validator) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.passwordPolicyValidator = passwordPolicyValidator;
        this.validator = validator;
    }

    public Optional<User> findById(String id) {
        Assert.hasText(id, "id must not be empty");
        return userRepository.findById(id);
    }

    public Optional<User> findByUserName(String userName) {
        Assert.hasText(userName, "userName must not be empty");
        return userRepository.findByUserName(userName);
    }

    /**
     * Attach a first password to an account without one.
     */
    public ServiceResult<Void> addPassword(User user, String password) {
        Assert.notNull(user, "user must not be null");

        if (user.hasPassword()) {
            return refuse(List.of("User already has a password set."));
        }

        List<String> violations = passwordPolicyValidator.validate(password);
        if (!violations.isEmpty()) {
            return refuse(violations);
        }

        user.setPasswordHash(passwordEncoder.encode(password));
        return save(user);
    }

    /**
     * Replace the password after verifying the current one.
     */
    public ServiceResult<Void> changePassword(User user, String currentPassword, String newPassword) {
        Assert.notNull(user, "user must not be null");

        if (!checkPassword(user, currentPassword)) {
            return refuse(List.of("Incorrect password."));
        }

        List<String> violations = passwordPolicyValidator.validate(newPassword);
        if (!violations.isEmpty()) {
            return refuse(violations);
        }

        user.setPasswordHash(passwordEncoder.encode(newPassword));
        return save(user);
    }

    /**
     * @return false when the account has no password or the password does not verify
     */
    public boolean checkPassword(User user, String password) {
        Assert.notNull(user, "user must not be null");
        if (!user.hasPassword() || password == null) {
            return false;
        }
        return passwordEncoder.matches(password, user.getPasswordHash());
    }

    public ServiceResult<User> create(User user) {
        Assert.notNull(user, "user must not be null");

        List<String> errors = findWriteErrors(user);
        if (!errors.isEmpty()) {
            log.info("User {} rejected by store: {}", user.getUserName(), errors);
            return refuse(errors);
        }
        return ServiceResult.success(userRepository.saveAndFlush(user));
    }

    public ServiceResult<Void> update(User user) {
        Assert.notNull(user, "user must not be null");

        List<String> errors = findWriteErrors(user);
        if (!errors.isEmpty()) {
            log.info("User {} rejected by store: {}", user.getId(), errors);
            return refuse(errors);
        }
        return save(user);
    }

    /**
     * Role rows cascade with the account; password history is removed by the caller.
     */
    public ServiceResult<Void> delete(User user) {
        Assert.notNull(user, "user must not be null");

        userRepository.delete(user);
        userRepository.flush();
        return ServiceResult.success();
    }

    private ServiceResult<Void> save(User user) {
        userRepository.saveAndFlush(user);
        return ServiceResult.success();
    }

    /**
     * The refused change may already sit on the managed entity: the surrounding
     * transaction is rolled back quietly so it is never flushed.
     */
    private <T> ServiceResult<T> refuse(List<String> errors) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
        }
        return ServiceResult.failure(ServiceError.STORE_FAILURE, errors);
    }

    private List<String> findWriteErrors(User user) {
        List<String> violations = validator.validate(user).stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .toList();
        if (!violations.isEmpty()) {
            return violations;
        }
        return findUniquenessConflicts(user);
    }

    private List<String> findUniquenessConflicts(User user) {
        List<String> conflicts = new ArrayList<>();
        boolean isNew = user.getId() == null;

        boolean userNameTaken = isNew
                ? userRepository.existsByUserName(user.getUserName())
                : userRepository.existsByUserNameAndIdNot(user.getUserName(), user.getId());
        if (userNameTaken) {
            conflicts.add("Username '" + user.getUserName() + "' is already taken.");
        }

        boolean emailTaken = isNew
                ? userRepository.existsByEmail(user.getEmail())
                : userRepository.existsByEmailAndIdNot(user.getEmail(), user.getId());
        if (emailTaken) {
            conflicts.add("Email '" + user.getEmail() + "' is already taken.");
        }
        return conflicts;
    }
}
