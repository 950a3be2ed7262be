package com.example.identityapi.repository;

import com.example.identityapi.entity.AuditAction;
import com.example.identityapi.entity.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for AuditLog entity.
 * Paginated queries only, audit tables grow without bound.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    /**
     * Find audit logs by action type.
     * Use case: View all permission denials.
     */
    Page<AuditLog> findByAction(AuditAction action, Pageable pageable);
}
