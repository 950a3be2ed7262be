package com.example.identityapi.service;

import com.example.identityapi.entity.AuditAction;
import com.example.identityapi.entity.AuditLog;
import com.example.identityapi.entity.Role;
import com.example.identityapi.repository.AuditLogRepository;
import com.example.identityapi.security.ActingPrincipal;
import com.example.identityapi.security.CorrelationIdFilter;
import com.example.identityapi.service.result.ServiceError;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    @Mock
    private AuditLogRepository auditLogRepository;

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(auditLogRepository, new ObjectMapper());
    }

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void permissionDenialRecordsActorTargetAndRequestOrigin() {
        MDC.put(CorrelationIdFilter.MDC_CLIENT_IP, "10.0.0.7");
        MDC.put(CorrelationIdFilter.MDC_USER_AGENT, "curl/8.0");

        auditService.logPermissionDenied(new ActingPrincipal("a1", "alice", Set.of(Role.ADMIN)),
                "u2", "DELETE_USER");

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        AuditLog saved = captor.getValue();
        assertEquals(AuditAction.PERMISSION_DENIED, saved.getAction());
        assertEquals(AuditLog.AuditOutcome.DENIED, saved.getOutcome());
        assertEquals("u2", saved.getEntityId());
        assertEquals("a1", saved.getActorId());
        assertEquals("alice", saved.getActorName());
        assertEquals("{\"operation\":\"DELETE_USER\"}", saved.getNewValue());
        assertEquals("10.0.0.7", saved.getIpAddress());
        assertEquals("curl/8.0", saved.getUserAgent());
    }

    @Test
    void anonymousActorIsNamed() {
        auditService.logPermissionDenied(null, "u2", "UPDATE_PASSWORD");

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertEquals("ANONYMOUS", captor.getValue().getActorName());
    }

    @Test
    void longUserAgentIsTruncated() {
        MDC.put(CorrelationIdFilter.MDC_USER_AGENT, "x".repeat(800));

        auditService.logLoginSuccess("u1", "user-u1");

        ArgumentCaptor<AuditLog> captor = ArgumentCaptor.forClass(AuditLog.class);
        verify(auditLogRepository).save(captor.capture());
        assertEquals(500, captor.getValue().getUserAgent().length());
    }

    @Test
    void storageFailureDoesNotPropagate() {
        when(auditLogRepository.save(any())).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> auditService.logLoginFailure("ghost", "Unknown user name"));
    }

    @Test
    void logsAreFilteredByAction() {
        Page<AuditLog> page = new PageImpl<>(List.of());
        when(auditLogRepository.findByAction(eq(AuditAction.LOGIN_FAILED), any(Pageable.class))).thenReturn(page);

        assertEquals(page, auditService.getLogs(AuditAction.LOGIN_FAILED, 1, 20));
        verify(auditLogRepository, never()).findAll(any(Pageable.class));
    }

    @Test
    void pageNumbersStartAtOne() {
        assertThrows(IllegalArgumentException.class, () -> auditService.getLogs(null, 0, 20));
    }

    @Test
    void deletingUnknownLogFails() {
        when(auditLogRepository.existsById(42L)).thenReturn(false);

        assertTrue(auditService.deleteLog(42L).hasError(ServiceError.AUDIT_LOG_NOT_FOUND));
        verify(auditLogRepository, never()).deleteById(any());
    }
}
