package com.example.identityapi.controller;

import com.example.identityapi.dto.AssignRoleRequest;
import com.example.identityapi.dto.RoleResponse;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.security.SecurityContextHelper;
import com.example.identityapi.service.RoleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Role endpoints. SuperAdmin only.
 */
@RestController
@RequestMapping("/api/v1/roles")
@Tag(name = "Roles", description = "Role membership management")
@PreAuthorize("hasRole('SUPER_ADMIN')")
public class RoleController {

    private final RoleService roleService;
    private final SecurityContextHelper securityContextHelper;

    public RoleController(RoleService roleService, SecurityContextHelper securityContextHelper) {
        this.roleService = roleService;
        this.securityContextHelper = securityContextHelper;
    }

    @Operation(summary = "List roles")
    @GetMapping
    public ResponseEntity<List<RoleResponse>> getRoles() {
        List<RoleResponse> roles = roleService.getRoles().stream().map(RoleResponse::from).toList();
        if (roles.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(roles);
    }

    @Operation(
            summary = "Assign role",
            responses = {
                    @ApiResponse(responseCode = "204", description = "Role assigned"),
                    @ApiResponse(responseCode = "400", description = "Inactive user, unknown role or role already held"),
                    @ApiResponse(responseCode = "403", description = "Not allowed to act on this user"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            }
    )
    @PostMapping("/users/{id}/roles")
    public ResponseEntity<?> assignRole(
            @Parameter(description = "User ID") @PathVariable("id") String id,
            @Valid @RequestBody AssignRoleRequest request) {
        return ServiceResponses.noContent(roleService.assignRole(currentPrincipal(), id, request.roleName()));
    }

    @Operation(summary = "Remove role")
    @DeleteMapping("/users/{id}/roles/{roleName}")
    public ResponseEntity<?> removeRole(
            @Parameter(description = "User ID") @PathVariable("id") String id,
            @PathVariable("roleName") String roleName) {
        return ServiceResponses.noContent(roleService.removeRole(currentPrincipal(), id, roleName));
    }

    private ActingPrincipal currentPrincipal() {
        return securityContextHelper.getCurrentPrincipal().orElse(null);
    }
}
