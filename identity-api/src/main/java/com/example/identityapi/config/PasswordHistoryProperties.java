package com.example.identityapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retention window of the password history kept for reuse detection.
 */
@ConfigurationProperties(prefix = "identity.password-history")
public class PasswordHistoryProperties {

    public static final int DEFAULT_RETENTION = 5;

    private int retention = DEFAULT_RETENTION;

    public int getRetention() {
        return retention;
    }

    public void setRetention(int retention) {
        this.retention = retention;
    }
}
