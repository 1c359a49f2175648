package com.storefront.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Objects;

import com.storefront.backend.modules.audit.domain.AuditLog;
import com.storefront.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditEvent event) {
        Objects.requireNonNull(event.action(), "action is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setAction(event.action());
        auditLog.setUserId(event.userId());
        auditLog.setIp(event.ip());
        auditLog.setUserAgent(event.userAgent());
        auditLog.setCreatedAt(event.occurredAt());

        if (event.metadata() != null && !event.metadata().isEmpty()) {
            auditLog.setMetadata(new LinkedHashMap<>(event.metadata()));
        }

        auditLogRepository.save(auditLog);
    }
}
