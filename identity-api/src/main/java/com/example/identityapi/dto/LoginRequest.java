package com.example.identityapi.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Login request DTO.
 */
public record LoginRequest(
    @NotBlank(message = "User name is required")
    String userName,

    @NotBlank(message = "Password is required")
    String password
) {
}
