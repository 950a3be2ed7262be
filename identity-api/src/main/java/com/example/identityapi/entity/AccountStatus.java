package com.example.identityapi.entity;

/**
 * User account status
 *
 * Controls whether user can authenticate and receive roles.
 * The numeric code is the value exposed to API clients.
 */
public enum AccountStatus {
    /**
     * Provisioned but not activated - cannot login
     */
    INACTIVE(0),

    /**
     * User can login normally
     */
    ACTIVE(1);

    private final int code;

    AccountStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static AccountStatus fromCode(int code) {
        for (AccountStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown account status: " + code);
    }
}
