package com.example.identityapi.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Password rotation: the current password must verify before the new one is stored.
 */
public record UpdatePasswordRequest(
    @NotBlank(message = "Current password is required")
    String currentPassword,

    @NotBlank(message = "New password is required")
    String newPassword
) {
}
