package com.example.identityapi.controller;

import com.example.identityapi.dto.AuditLogListResponse;
import com.example.identityapi.dto.AuditLogResponse;
import com.example.identityapi.dto.PaginationMetadata;
import com.example.identityapi.entity.AuditAction;
import com.example.identityapi.entity.AuditLog;
import com.example.identityapi.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Audit trail endpoints. SuperAdmin only.
 */
@RestController
@RequestMapping("/api/v1/audit-logs")
@Tag(name = "Audit logs", description = "Audit trail of security-sensitive operations")
@PreAuthorize("hasRole('SUPER_ADMIN')")
public class AuditLogController {

    private final AuditService auditService;

    public AuditLogController(AuditService auditService) {
        this.auditService = auditService;
    }

    @Operation(summary = "List audit logs, newest first")
    @GetMapping
    public ResponseEntity<AuditLogListResponse> getLogs(
            @Parameter(description = "Filter by action") @RequestParam(name = "action", required = false) AuditAction action,
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "pageSize", defaultValue = "10") int pageSize) {

        Page<AuditLog> logs = auditService.getLogs(action, page, pageSize);
        if (logs.isEmpty()) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(new AuditLogListResponse(
                logs.getContent().stream().map(AuditLogResponse::from).toList(),
                PaginationMetadata.from(logs)));
    }

    @Operation(summary = "Delete audit log")
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteLog(@PathVariable("id") Long id) {
        return ServiceResponses.noContent(auditService.deleteLog(id));
    }
}
