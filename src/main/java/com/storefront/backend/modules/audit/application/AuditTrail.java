package com.storefront.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.storefront.backend.modules.audit.domain.AuditAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Fire-and-forget entry point for security events. {@link #enqueue} returns immediately and never
 * throws; persistence happens on the audit executor in its own transaction.
 * <p>
 * Events that describe a completed change go through {@link #enqueueAfterCommit} so a rolled back
 * transaction leaves no record of them. Failure events use {@link #enqueue} and survive the rollback.
 */
@Component
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);
    private static final Set<String> REDACTED_KEYS = Set.of("password", "newPassword", "token", "refreshToken");
    private static final String REDACTED = "***";

    private final AuditLogService auditLogService;
    private final TaskExecutor auditExecutor;
    private final Clock clock;

    public AuditTrail(AuditLogService auditLogService,
                      @Qualifier("auditExecutor") TaskExecutor auditExecutor,
                      Clock clock) {
        this.auditLogService = auditLogService;
        this.auditExecutor = auditExecutor;
        this.clock = clock;
    }

    public void enqueue(AuditAction action, UUID userId, String ip, String userAgent, Map<String, Object> metadata) {
        try {
            AuditEvent event = new AuditEvent(action, userId, ip, userAgent, redact(metadata), OffsetDateTime.now(clock));
            auditExecutor.execute(() -> persist(event));
            log.debug("Enqueued audit event {} user={}", action, userId != null ? userId : "N/A");
        } catch (RuntimeException ex) {
            log.error("Failed to enqueue audit event {}", action, ex);
        }
    }

    public void enqueue(AuditAction action, UUID userId) {
        enqueue(action, userId, null, null, null);
    }

    /**
     * Defers {@link #enqueue} until the surrounding transaction commits. Without an active
     * transaction the event is enqueued right away.
     */
    public void enqueueAfterCommit(AuditAction action, UUID userId, String ip, String userAgent,
                                   Map<String, Object> metadata) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            enqueue(action, userId, ip, userAgent, metadata);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                enqueue(action, userId, ip, userAgent, metadata);
            }
        });
    }

    public void enqueueAfterCommit(AuditAction action, UUID userId) {
        enqueueAfterCommit(action, userId, null, null, null);
    }

    private void persist(AuditEvent event) {
        try {
            auditLogService.record(event);
        } catch (RuntimeException ex) {
            log.error("Failed to persist audit event {} user={}", event.action(), event.userId(), ex);
        }
    }

    static Map<String, Object> redact(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return metadata;
        }
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        copy.replaceAll((key, value) -> REDACTED_KEYS.contains(key) && value != null ? REDACTED : value);
        return copy;
    }
}
