package com.example.identityapi.dto;

/**
 * Account status counts across all users.
 */
public record UserStateMetricsResponse(long totalCount, long activatedUsers, long deactivatedUsers) {
}
