package com.astralcore.mfa.domain.audit;

import com.astralcore.mfa.domain.mfa.MfaMethod;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One structured security event. Metadata must already be masked: never secrets, codes or full destinations.
 */
public record AuditEvent(
        UUID eventId,
        AuditCategory category,
        String action,
        AuditOutcome outcome,
        RiskLevel riskLevel,
        String description,
        String userId,
        String userEmail,
        MfaMethod method,
        Map<String, Object> metadata,
        OffsetDateTime occurredAt
) {
    public AuditEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
