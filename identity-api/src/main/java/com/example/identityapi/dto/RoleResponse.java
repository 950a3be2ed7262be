package com.example.identityapi.dto;

import com.example.identityapi.entity.Role;

public record RoleResponse(String id, String name) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(role.name(), role.getDisplayName());
    }
}
