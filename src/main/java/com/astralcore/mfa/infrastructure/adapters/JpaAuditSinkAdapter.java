package com.astralcore.mfa.infrastructure.adapters;

import com.astralcore.mfa.domain.audit.AuditEvent;
import com.astralcore.mfa.domain.ports.AuditSink;
import com.astralcore.mfa.infrastructure.jpa.MfaAuditEventEntity;
import com.astralcore.mfa.infrastructure.jpa.SpringMfaAuditEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends audit events to {@code mfa_audit_events}. Runs in its own transaction so failure events survive a
 * rolled-back request.
 */
@Component
public class JpaAuditSinkAdapter implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditSinkAdapter.class);

    private final SpringMfaAuditEventRepository repository;
    private final ObjectMapper objectMapper;

    public JpaAuditSinkAdapter(SpringMfaAuditEventRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditEvent event) {
        MfaAuditEventEntity entity = new MfaAuditEventEntity();
        entity.setEventId(event.eventId());
        entity.setCategory(event.category());
        entity.setAction(event.action());
        entity.setOutcome(event.outcome());
        entity.setRiskLevel(event.riskLevel());
        entity.setDescription(event.description());
        entity.setUserId(event.userId());
        entity.setUserEmail(event.userEmail());
        entity.setMethod(event.method());
        entity.setMetadataJson(toJson(event));
        entity.setOccurredAt(event.occurredAt());

        repository.save(entity);
        log.debug("Audit event stored - ID: {}, Action: {}, Risk: {}", event.eventId(), event.action(), event.riskLevel());
    }

    private String toJson(AuditEvent event) {
        if (event.metadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.metadata());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Audit metadata is not serializable for event " + event.eventId(), e);
        }
    }
}
