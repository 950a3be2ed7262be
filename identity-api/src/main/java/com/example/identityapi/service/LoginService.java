package com.example.identityapi.service;

import com.example.identityapi.dto.LoginRequest;
import com.example.identityapi.dto.LoginResponse;
import com.example.identityapi.entity.User;
import com.example.identityapi.service.result.ServiceError;
import com.example.identityapi.service.result.ServiceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.Assert;

import java.util.Optional;

/**
 * Login: exchanges user name and password for an access token.
 *
 * Checks, in order: account exists, account is active, password verifies.
 * Every outcome is audited.
 */
@Service
public class LoginService {

    private static final Logger log = LoggerFactory.getLogger(LoginService.class);

    private final UserAccountManager userAccountManager;
    private final JwtService jwtService;
    private final AuditService auditService;

    public LoginService(UserAccountManager userAccountManager,
                        JwtService jwtService,
                        AuditService auditService) {
        this.userAccountManager = userAccountManager;
        this.jwtService = jwtService;
        this.auditService = auditService;
    }

    @Transactional(readOnly = true)
    public ServiceResult<LoginResponse> login(LoginRequest request) {
        Assert.notNull(request, "request must not be null");
        Assert.hasText(request.userName(), "userName must not be empty");
        Assert.hasText(request.password(), "password must not be empty");

        Optional<User> found = userAccountManager.findByUserName(request.userName());
        if (found.isEmpty()) {
            log.warn("Login failed: unknown user name {}", request.userName());
            auditService.logLoginFailure(request.userName(), "Unknown user name");
            return ServiceResult.failure(ServiceError.USER_NOT_FOUND);
        }

        User user = found.get();
        if (!user.isActive()) {
            log.warn("Login denied: user {} is not activated", user.getId());
            auditService.logLoginDenied(user.getId(), user.getUserName(), "Account not activated");
            return ServiceResult.failure(ServiceError.NOT_ACTIVATED);
        }

        if (!userAccountManager.checkPassword(user, request.password())) {
            log.warn("Login failed: invalid password for user {}", user.getId());
            auditService.logLoginFailure(user.getUserName(), "Invalid password");
            return ServiceResult.failure(ServiceError.INVALID_CREDENTIALS);
        }

        String token = jwtService.generateAccessToken(user);
        auditService.logLoginSuccess(user.getId(), user.getUserName());
        log.info("User {} logged in", user.getId());

        return ServiceResult.success(LoginResponse.bearer(token, jwtService.getAccessTokenExpirationSeconds()));
    }
}
