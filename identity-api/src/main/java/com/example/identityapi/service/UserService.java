package com.example.identityapi.service;

import com.example.identityapi.dto.PaginationMetadata;
import com.example.identityapi.dto.UserAuditDto;
import com.example.identityapi.dto.UserCreationStatsResponse;
import com.example.identityapi.dto.UserDto;
import com.example.identityapi.dto.UserListResponse;
import com.example.identityapi.dto.UserRequest;
import com.example.identityapi.dto.UserStateMetricsResponse;
import com.example.identityapi.entity.AccountStatus;
import com.example.identityapi.entity.Country;
import com.example.identityapi.entity.User;
import com.example.identityapi.repository.UserRepository;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.Optional;

/**
 * Service for user account management.
 *
 * Every operation on an existing account goes through {@link PermissionGate}:
 * Forbidden before UserNotFound, then the operation's own precondition.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final UserAccountManager userAccountManager;
    private final PermissionGate permissionGate;
    private final CountryService countryService;
    private final PasswordHistoryCleanupService cleanupService;
    private final AuditService auditService;

    public UserService(UserRepository userRepository,
                       UserAccountManager userAccountManager,
                       PermissionGate permissionGate,
                       CountryService countryService,
                       PasswordHistoryCleanupService cleanupService,
                       AuditService auditService) {
        this.userRepository = userRepository;
        this.userAccountManager = userAccountManager;
        this.permissionGate = permissionGate;
        this.countryService = countryService;
        this.cleanupService = cleanupService;
        this.auditService = auditService;
    }

    // ==================== Queries ====================

    /**
     * Page through users ordered by last name.
     *
     * @param page 1-based page number
     * @param pageSize page size
     * @param accountStatus optional filter, 0 inactive, 1 active
     */
    @Transactional(readOnly = true)
    public UserListResponse getUsers(int page, int pageSize, Integer accountStatus) {
        Assert.isTrue(page >= 1, "page must be at least 1");
        Assert.isTrue(pageSize >= 1, "pageSize must be at least 1");

        AccountStatus status = accountStatus != null ? AccountStatus.fromCode(accountStatus) : null;
        PageRequest pageable = PageRequest.of(page - 1, pageSize, Sort.by("lastName", "firstName", "id"));

        Page<User> users = userRepository.findAllWithStatus(status, pageable);
        return new UserListResponse(
                users.getContent().stream().map(UserDto::fromEntity).toList(),
                PaginationMetadata.from(users));
    }

    @Transactional(readOnly = true)
    public ServiceResult<UserDto> getUser(ActingPrincipal principal, String id) {
        return permissionGate.execute(principal, id, "GET_USER",
                user -> ServiceResult.success(UserDto.fromEntity(user)));
    }

    @Transactional(readOnly = true)
    public UserStateMetricsResponse getUserStateMetrics() {
        long total = userRepository.count();
        long activated = userRepository.countByAccountStatus(AccountStatus.ACTIVE);
        return new UserStateMetricsResponse(total, activated, total - activated);
    }

    @Transactional(readOnly = true)
    public UserCreationStatsResponse getUserCreationStats() {
        return new UserCreationStatsResponse(userRepository.countCreatedPerDay());
    }

    // ==================== Mutations ====================

    /**
     * Register a new account: inactive, no password, no role.
     */
    @Transactional
    public ServiceResult<UserDto> createUser(UserRequest request) {
        validateUserRequest(request);

        Optional<Country> country = countryService.findCountryById(request.countryId());
        if (country.isEmpty()) {
            return ServiceResult.failure(ServiceError.COUNTRY_NOT_FOUND);
        }

        User user = new User();
        applyProfile(user, request, country.get());

        ServiceResult<User> created = userAccountManager.create(user);
        if (!created.isSuccess()) {
            return created.propagateFailure();
        }

        auditService.logUserCreated(UserAuditDto.from(created.value()));
        log.info("User {} created with id {}", created.value().getUserName(), created.value().getId());
        return created.map(UserDto::fromEntity);
    }

    @Transactional
    public ServiceResult<Void> updateUser(ActingPrincipal principal, String id, UserRequest request) {
        Assert.hasText(id, "id must not be empty");
        validateUserRequest(request);

        return permissionGate.execute(principal, id, "UPDATE_USER", user -> {
            Optional<Country> country = countryService.findCountryById(request.countryId());
            if (country.isEmpty()) {
                return ServiceResult.failure(ServiceError.COUNTRY_NOT_FOUND);
            }

            UserAuditDto before = UserAuditDto.from(user);
            applyProfile(user, request, country.get());

            ServiceResult<Void> updated = userAccountManager.update(user);
            if (updated.isSuccess()) {
                auditService.logUserUpdated(principal, before, UserAuditDto.from(user));
                log.info("User {} updated", id);
            }
            return updated;
        });
    }

    /**
     * Delete the account, then all of its password history.
     */
    @Transactional
    public ServiceResult<Void> deleteUser(ActingPrincipal principal, String id) {
        return permissionGate.execute(principal, id, "DELETE_USER", user -> {
            UserAuditDto snapshot = UserAuditDto.from(user);

            ServiceResult<Void> deleted = userAccountManager.delete(user);
            if (!deleted.isSuccess()) {
                return deleted;
            }

            cleanupService.deletePasswordHistory(id);
            auditService.logUserDeleted(principal, snapshot);
            log.info("User {} deleted", id);
            return deleted;
        });
    }

    @Transactional
    public ServiceResult<Void> activateUser(ActingPrincipal principal, String id) {
        return permissionGate.execute(principal, id, "ACTIVATE_USER", user -> {
            if (user.isActive()) {
                return ServiceResult.failure(ServiceError.ALREADY_ACTIVATED);
            }

            user.activate();
            ServiceResult<Void> updated = userAccountManager.update(user);
            if (updated.isSuccess()) {
                auditService.logAccountActivated(principal, id);
                log.info("User {} activated", id);
            }
            return updated;
        });
    }

    @Transactional
    public ServiceResult<Void> deactivateUser(ActingPrincipal principal, String id) {
        return permissionGate.execute(principal, id, "DEACTIVATE_USER", user -> {
            if (!user.isActive()) {
                return ServiceResult.failure(ServiceError.NOT_ACTIVATED);
            }

            user.deactivate();
            ServiceResult<Void> updated = userAccountManager.update(user);
            if (updated.isSuccess()) {
                auditService.logAccountDeactivated(principal, id);
                log.info("User {} deactivated", id);
            }
            return updated;
        });
    }

    // ==================== Internal ====================

    private void validateUserRequest(UserRequest request) {
        Assert.notNull(request, "user must not be null");
        Assert.hasText(request.userName(), "userName must not be empty");
        Assert.hasText(request.firstName(), "firstName must not be empty");
        Assert.hasText(request.lastName(), "lastName must not be empty");
        Assert.hasText(request.email(), "email must not be empty");
        Assert.hasText(request.phoneNumber(), "phoneNumber must not be empty");
    }

    private void applyProfile(User user, UserRequest request, Country country) {
        user.setUserName(request.userName());
        user.setFirstName(request.firstName());
        user.setLastName(request.lastName());
        user.setEmail(request.email());
        user.setPhoneNumber(request.phoneNumber());
        user.setCountry(country);
    }
}
