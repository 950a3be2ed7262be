package com.example.identityapi.controller;

import com.example.identityapi.dto.UserCreationStatsResponse;
import com.example.identityapi.dto.UserDto;
import com.example.identityapi.dto.UserListResponse;
import com.example.identityapi.dto.UserRequest;
import com.example.identityapi.dto.UserStateMetricsResponse;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.security.SecurityContextHelper;
import com.example.identityapi.service.UserService;
import com.example.identityapi.service.result.ServiceResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * User account endpoints.
 *
 * Role checks here are coarse. Rank checks against the target account happen in the services.
 */
@RestController
@RequestMapping("/api/v1/users")
@Tag(name = "Users", description = "User account management")
public class UserController {

    private final UserService userService;
    private final SecurityContextHelper securityContextHelper;

    public UserController(UserService userService, SecurityContextHelper securityContextHelper) {
        this.userService = userService;
        this.securityContextHelper = securityContextHelper;
    }

    @Operation(
            summary = "List users",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Page of users"),
                    @ApiResponse(responseCode = "204", description = "No users on this page")
            }
    )
    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<UserListResponse> getUsers(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "pageSize", defaultValue = "10") int pageSize,
            @RequestParam(name = "accountStatus", required = false) Integer accountStatus) {

        UserListResponse users = userService.getUsers(page, pageSize, accountStatus);
        if (users.users().isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(users);
    }

    @Operation(summary = "Account status counts")
    @GetMapping("/state-metrics")
    @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<UserStateMetricsResponse> getUserStateMetrics() {
        return ResponseEntity.ok(userService.getUserStateMetrics());
    }

    @Operation(summary = "Accounts created per day")
    @GetMapping("/creation-stats")
    @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<UserCreationStatsResponse> getUserCreationStats() {
        UserCreationStatsResponse stats = userService.getUserCreationStats();
        if (stats.userCreationStats().isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(stats);
    }

    @Operation(
            summary = "Get user",
            responses = {
                    @ApiResponse(responseCode = "200", description = "User found"),
                    @ApiResponse(responseCode = "403", description = "Not allowed to read this user"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            }
    )
    @GetMapping("/{id}")
    public ResponseEntity<?> getUser(@Parameter(description = "User ID") @PathVariable("id") String id) {
        return ServiceResponses.ok(userService.getUser(currentPrincipal(), id));
    }

    /**
     * Registration. The account starts inactive, without password and role.
     */
    @Operation(
            summary = "Create user",
            responses = {
                    @ApiResponse(responseCode = "201", description = "User created"),
                    @ApiResponse(responseCode = "400", description = "Unknown country, duplicate user name or email")
            }
    )
    @PostMapping
    public ResponseEntity<?> createUser(@Valid @RequestBody UserRequest request) {
        ServiceResult<UserDto> created = userService.createUser(request);
        if (!created.isSuccess()) {
            return ServiceResponses.failure(created);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(created.value());
    }

    @Operation(summary = "Update user")
    @PutMapping("/{id}")
    public ResponseEntity<?> updateUser(
            @Parameter(description = "User ID") @PathVariable("id") String id,
            @Valid @RequestBody UserRequest request) {
        return ServiceResponses.noContent(userService.updateUser(currentPrincipal(), id, request));
    }

    @Operation(summary = "Delete user and password history")
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteUser(@Parameter(description = "User ID") @PathVariable("id") String id) {
        return ServiceResponses.noContent(userService.deleteUser(currentPrincipal(), id));
    }

    @Operation(summary = "Activate user")
    @PatchMapping("/activate/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<?> activateUser(@Parameter(description = "User ID") @PathVariable("id") String id) {
        return ServiceResponses.noContent(userService.activateUser(currentPrincipal(), id));
    }

    @Operation(summary = "Deactivate user")
    @PatchMapping("/deactivate/{id}")
    @PreAuthorize("hasAnyRole('ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<?> deactivateUser(@Parameter(description = "User ID") @PathVariable("id") String id) {
        return ServiceResponses.noContent(userService.deactivateUser(currentPrincipal(), id));
    }

    private ActingPrincipal currentPrincipal() {
        return securityContextHelper.getCurrentPrincipal().orElse(null);
    }
}
