package com.example.identityapi.dto;

import com.example.identityapi.entity.Role;
import com.example.identityapi.entity.User;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

/**
 * User DTO for API responses. Never carries the password hash.
 */
public record UserDto(
    @JsonProperty("id")
    String id,

    @JsonProperty("userName")
    String userName,

    @JsonProperty("firstName")
    String firstName,

    @JsonProperty("lastName")
    String lastName,

    @JsonProperty("email")
    String email,

    @JsonProperty("phoneNumber")
    String phoneNumber,

    // 0 = inactive, 1 = active
    @JsonProperty("accountStatus")
    int accountStatus,

    @JsonProperty("roles")
    List<String> roles,

    @JsonProperty("countryId")
    Integer countryId,

    @JsonProperty("countryName")
    String countryName,

    @JsonProperty("createdAt")
    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime createdAt
) {
    /**
     * Factory method to create UserDto from User entity.
     */
    public static UserDto fromEntity(User user) {
        return new UserDto(
            user.getId(),
            user.getUserName(),
            user.getFirstName(),
            user.getLastName(),
            user.getEmail(),
            user.getPhoneNumber(),
            user.getAccountStatus().getCode(),
            user.getRoles().stream().sorted().map(Role::getDisplayName).toList(),
            user.getCountry() != null ? user.getCountry().getId() : null,
            user.getCountry() != null ? user.getCountry().getName() : null,
            user.getCreatedAt()
        );
    }
}
