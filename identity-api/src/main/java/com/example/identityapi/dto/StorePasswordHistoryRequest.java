package com.example.identityapi.dto;

/**
 * Hash to append to a user's password history.
 */
public record StorePasswordHistoryRequest(String userId, String passwordHash) {
}
