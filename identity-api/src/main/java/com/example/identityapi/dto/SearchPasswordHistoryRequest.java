package com.example.identityapi.dto;

/**
 * Plaintext candidate checked against a user's password history.
 */
public record SearchPasswordHistoryRequest(String userId, String password) {
}
