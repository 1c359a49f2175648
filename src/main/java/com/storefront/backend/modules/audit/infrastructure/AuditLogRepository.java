package com.storefront.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import com.storefront.backend.modules.audit.domain.AuditAction;
import com.storefront.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByUserIdOrderByCreatedAtAsc(UUID userId);

    long countByAction(AuditAction action);
}
