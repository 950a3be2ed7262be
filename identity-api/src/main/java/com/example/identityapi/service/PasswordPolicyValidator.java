package com.example.identityapi.service;

import com.example.identityapi.config.PasswordPolicyProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks a plaintext password against the configured strength rules.
 */
@Component
public class PasswordPolicyValidator {

    private static final Pattern UPPERCASE = Pattern.compile("[A-Z]");
    private static final Pattern LOWERCASE = Pattern.compile("[a-z]");
    private static final Pattern DIGIT = Pattern.compile("[0-9]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");

    private final PasswordPolicyProperties policy;

    public PasswordPolicyValidator(PasswordPolicyProperties policy) {
        this.policy = policy;
    }

    /**
     * @return every rule the password breaks, empty when it is acceptable
     */
    public List<String> validate(String password) {
        List<String> violations = new ArrayList<>();
        if (password == null) {
            violations.add("Password is required.");
            return violations;
        }

        if (password.length() < policy.getMinLength()) {
            violations.add("Passwords must be at least " + policy.getMinLength() + " characters.");
        }
        if (policy.isRequireUppercase() && !UPPERCASE.matcher(password).find()) {
            violations.add("Passwords must have at least one uppercase ('A'-'Z').");
        }
        if (policy.isRequireLowercase() && !LOWERCASE.matcher(password).find()) {
            violations.add("Passwords must have at least one lowercase ('a'-'z').");
        }
        if (policy.isRequireDigit() && !DIGIT.matcher(password).find()) {
            violations.add("Passwords must have at least one digit ('0'-'9').");
        }
        if (policy.isRequireNonAlphanumeric() && !NON_ALPHANUMERIC.matcher(password).find()) {
            violations.add("Passwords must have at least one non alphanumeric character.");
        }
        return violations;
    }
}
