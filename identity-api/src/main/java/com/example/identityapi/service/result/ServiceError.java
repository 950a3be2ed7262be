package com.example.identityapi.service.result;

import org.springframework.http.HttpStatus;

/**
 * Expected business failures returned by services instead of thrown.
 * Each failure carries the HTTP status it maps to at the API boundary.
 */
public enum ServiceError {

    // Authorization
    FORBIDDEN(HttpStatus.FORBIDDEN, "You do not have permission to access this resource."),

    // Users
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found."),
    ALREADY_ACTIVATED(HttpStatus.BAD_REQUEST, "User account is already activated."),
    NOT_ACTIVATED(HttpStatus.BAD_REQUEST, "User account is not activated."),
    COUNTRY_NOT_FOUND(HttpStatus.BAD_REQUEST, "Country not found."),

    // Passwords
    PASSWORD_MISMATCH(HttpStatus.BAD_REQUEST, "Passwords do not match."),
    PASSWORD_ALREADY_SET(HttpStatus.BAD_REQUEST, "Password has already been set for this user."),
    INVALID_CREDENTIALS(HttpStatus.BAD_REQUEST, "Invalid credentials."),
    CANNOT_REUSE(HttpStatus.BAD_REQUEST, "Cannot reuse a recent password."),

    // Roles
    INACTIVE_USER(HttpStatus.BAD_REQUEST, "Roles cannot be assigned to an inactive user."),
    INVALID_ROLE(HttpStatus.BAD_REQUEST, "Role does not exist."),
    USER_ALREADY_HAS_ROLE(HttpStatus.BAD_REQUEST, "User already has an assigned role."),
    MISSING_ROLE(HttpStatus.BAD_REQUEST, "User does not hold the requested role."),

    // Audit logs
    AUDIT_LOG_NOT_FOUND(HttpStatus.NOT_FOUND, "Audit log not found."),

    // Underlying persistence or password policy rejected the write
    STORE_FAILURE(HttpStatus.BAD_REQUEST, "The operation could not be completed.");

    private final HttpStatus status;
    private final String message;

    ServiceError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
