package com.astralcore.mfa.infrastructure.jpa;

import com.astralcore.mfa.domain.audit.AuditCategory;
import com.astralcore.mfa.domain.audit.AuditOutcome;
import com.astralcore.mfa.domain.audit.RiskLevel;
import com.astralcore.mfa.domain.mfa.MfaMethod;
import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "mfa_audit_events", indexes = @Index(name = "idx_mfa_audit_events_user", columnList = "user_id, occurred_at"))
public class MfaAuditEventEntity {

    @Id
    @Column(name = "event_id")
    private UUID eventId;

    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private AuditCategory category;

    @Column(nullable = false, length = 64)
    private String action;

    @Column(nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private AuditOutcome outcome;

    @Column(name = "risk_level", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private RiskLevel riskLevel;

    @Column(length = 500)
    private String description;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "user_email", length = 320)
    private String userEmail;

    @Column(length = 20)
    @Enumerated(EnumType.STRING)
    private MfaMethod method;

    @Column(name = "metadata_json", length = 4000)
    private String metadataJson;

    @Column(name = "occurred_at", nullable = false)
    private OffsetDateTime occurredAt;

    // Constructors
    public MfaAuditEventEntity() {}

    // Getters and Setters
    public UUID getEventId() { return eventId; }
    public void setEventId(UUID eventId) { this.eventId = eventId; }

    public AuditCategory getCategory() { return category; }
    public void setCategory(AuditCategory category) { this.category = category; }

    public String getAction() { return action; }
    public void setAction(String action) { this.action = action; }

    public AuditOutcome getOutcome() { return outcome; }
    public void setOutcome(AuditOutcome outcome) { this.outcome = outcome; }

    public RiskLevel getRiskLevel() { return riskLevel; }
    public void setRiskLevel(RiskLevel riskLevel) { this.riskLevel = riskLevel; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getUserEmail() { return userEmail; }
    public void setUserEmail(String userEmail) { this.userEmail = userEmail; }

    public MfaMethod getMethod() { return method; }
    public void setMethod(MfaMethod method) { this.method = method; }

    public String getMetadataJson() { return metadataJson; }
    public void setMetadataJson(String metadataJson) { this.metadataJson = metadataJson; }

    public OffsetDateTime getOccurredAt() { return occurredAt; }
    public void setOccurredAt(OffsetDateTime occurredAt) { this.occurredAt = occurredAt; }
}
