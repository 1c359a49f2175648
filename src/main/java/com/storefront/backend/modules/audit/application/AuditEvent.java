package com.storefront.backend.modules.audit.application;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.storefront.backend.modules.audit.domain.AuditAction;

public record AuditEvent(
        AuditAction action,
        UUID userId,
        String ip,
        String userAgent,
        Map<String, Object> metadata,
        OffsetDateTime occurredAt
) {
}
