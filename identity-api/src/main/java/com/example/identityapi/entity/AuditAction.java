package com.example.identityapi.entity;

/**
 * Audit action types for AuditLog.
 */
public enum AuditAction {
    // Entity lifecycle
    CREATE,              // User provisioned
    UPDATE,              // Profile modified
    DELETE,              // User removed together with password history

    // Authentication actions
    LOGIN_SUCCESS,
    LOGIN_FAILED,        // Wrong password or unknown user name
    LOGIN_DENIED,        // Account not activated

    // Account management
    ACCOUNT_ACTIVATED,
    ACCOUNT_DEACTIVATED,
    ROLE_ASSIGNED,
    ROLE_REMOVED,
    PASSWORD_SET,        // First password attached to an account
    PASSWORD_CHANGE,     // Password rotated

    // Authorization
    PERMISSION_DENIED    // Actor attempted to operate on a user outside its rank
}
