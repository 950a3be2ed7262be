package com.example.identityapi.controller;

import com.example.identityapi.dto.SetPasswordRequest;
import com.example.identityapi.dto.UpdatePasswordRequest;
import com.example.identityapi.security.SecurityContextHelper;
import com.example.identityapi.service.PasswordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Password endpoints.
 *
 * PUT is public: it sets the first password of a freshly registered account.
 * PATCH requires a token and a principal allowed to act on the target account.
 */
@RestController
@RequestMapping("/api/v1/users")
@Tag(name = "Password", description = "Password set and rotation")
public class PasswordController {

    private final PasswordService passwordService;
    private final SecurityContextHelper securityContextHelper;

    public PasswordController(PasswordService passwordService, SecurityContextHelper securityContextHelper) {
        this.passwordService = passwordService;
        this.securityContextHelper = securityContextHelper;
    }

    @Operation(
            summary = "Set first password",
            responses = {
                    @ApiResponse(responseCode = "204", description = "Password set"),
                    @ApiResponse(responseCode = "400", description = "Mismatch, already set or rejected by policy"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            }
    )
    @PutMapping("/{id}/password")
    public ResponseEntity<?> setPassword(
            @Parameter(description = "User ID") @PathVariable("id") String id,
            @Valid @RequestBody SetPasswordRequest request) {
        return ServiceResponses.noContent(passwordService.setPassword(id, request));
    }

    @Operation(
            summary = "Update password",
            responses = {
                    @ApiResponse(responseCode = "204", description = "Password updated"),
                    @ApiResponse(responseCode = "400", description = "Invalid credentials, reuse or rejected by policy"),
                    @ApiResponse(responseCode = "401", description = "Not authenticated"),
                    @ApiResponse(responseCode = "403", description = "Not allowed to act on this user")
            }
    )
    @PatchMapping("/{id}/password")
    public ResponseEntity<?> updatePassword(
            @Parameter(description = "User ID") @PathVariable("id") String id,
            @Valid @RequestBody UpdatePasswordRequest request) {
        return ServiceResponses.noContent(passwordService.updatePassword(
                securityContextHelper.getCurrentPrincipal().orElse(null), id, request));
    }
}
