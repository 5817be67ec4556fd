package com.astralcore.mfa.application;

import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.AuditEvent;
import com.astralcore.mfa.domain.audit.AuditOutcome;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import com.astralcore.mfa.domain.ports.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Builds audit events and hands them to the {@link AuditSink}. A failing sink is logged and never aborts the
 * operation being audited.
 */
@Component
public class MfaAuditEmitter {

    private static final Logger log = LoggerFactory.getLogger(MfaAuditEmitter.class);

    private final AuditSink sink;
    private final Clock clock;

    public MfaAuditEmitter(AuditSink sink, Clock clock) {
        this.sink = sink;
        this.clock = clock;
    }

    public void success(AuditCategory category, String action, RiskLevel riskLevel, String description,
                        String userId, String userEmail, MfaMethod method, Map<String, Object> metadata) {
        emit(category, action, AuditOutcome.SUCCESS, riskLevel, description, userId, userEmail, method, metadata);
    }

    public void failure(AuditCategory category, String action, RiskLevel riskLevel, String description,
                        String userId, String userEmail, MfaMethod method, Map<String, Object> metadata) {
        emit(category, action, AuditOutcome.FAILURE, riskLevel, description, userId, userEmail, method, metadata);
    }

    public void emit(AuditCategory category, String action, AuditOutcome outcome, RiskLevel riskLevel,
                     String description, String userId, String userEmail, MfaMethod method,
                     Map<String, Object> metadata) {
        AuditEvent event = new AuditEvent(UUID.randomUUID(), category, action, outcome, riskLevel, description,
                userId, userEmail, method, metadata, OffsetDateTime.now(clock));
        try {
            sink.record(event);
        } catch (RuntimeException e) {
            log.error("❌ Failed to record audit event {} ({}) for user {}: {}",
                    action, riskLevel, userId, e.getMessage(), e);
        }
    }
}
