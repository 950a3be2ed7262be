package com.example.identityapi.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * First password of an account that has none yet.
 */
public record SetPasswordRequest(
    @NotBlank(message = "Password is required")
    String password,

    @NotBlank(message = "Password confirmation is required")
    String passwordConfirmed
) {
}
