package com.example.identityapi.dto;

import java.util.List;

public record AuditLogListResponse(List<AuditLogResponse> logs, PaginationMetadata pagination) {
}
