package com.example.identityapi.dto;

import com.example.identityapi.entity.User;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for audit logging - excludes the password hash.
 *
 * Never serialize the User entity directly to audit logs.
 *
 * @see com.example.identityapi.service.AuditService
 */
public record UserAuditDto(
        String id,
        String userName,
        String email,
        String status,
        List<String> roles,
        Integer countryId,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static UserAuditDto from(User user) {
        return new UserAuditDto(
                user.getId(),
                user.getUserName(),
                user.getEmail(),
                user.getAccountStatus() != null ? user.getAccountStatus().name() : null,
                user.getRoles().stream().sorted().map(Enum::name).toList(),
                user.getCountry() != null ? user.getCountry().getId() : null,
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
