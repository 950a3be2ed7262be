package com.example.identityapi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Password strength rules applied whenever a password is stored.
 */
@ConfigurationProperties(prefix = "identity.password-policy")
public class PasswordPolicyProperties {

    private int minLength = 8;
    private boolean requireUppercase = true;
    private boolean requireLowercase = true;
    private boolean requireDigit = true;
    private boolean requireNonAlphanumeric = true;

    public int getMinLength() {
        return minLength;
    }

    public void setMinLength(int minLength) {
        this.minLength = minLength;
    }

    public boolean isRequireUppercase() {
        return requireUppercase;
    }

    public void setRequireUppercase(boolean requireUppercase) {
        this.requireUppercase = requireUppercase;
    }

    public boolean isRequireLowercase() {
        return requireLowercase;
    }

    public void setRequireLowercase(boolean requireLowercase) {
        this.requireLowercase = requireLowercase;
    }

    public boolean isRequireDigit() {
        return requireDigit;
    }

    public void setRequireDigit(boolean requireDigit) {
        this.requireDigit = requireDigit;
    }

    public boolean isRequireNonAlphanumeric() {
        return requireNonAlphanumeric;
    }

    public void setRequireNonAlphanumeric(boolean requireNonAlphanumeric) {
        this.requireNonAlphanumeric = requireNonAlphanumeric;
    }
}
