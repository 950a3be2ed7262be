package com.example.identityapi.dto;

import java.util.List;

public record UserListResponse(List<UserDto> users, PaginationMetadata pagination) {
}
