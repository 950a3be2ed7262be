package com.example.identityapi.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login response DTO.
 */
public record LoginResponse(
    @JsonProperty("token")
    String token,

    @JsonProperty("tokenType")
    String tokenType,

    @JsonProperty("expiresIn")
    long expiresIn
) {
    public static LoginResponse bearer(String token, long expiresInSeconds) {
        return new LoginResponse(token, "Bearer", expiresInSeconds);
    }
}
