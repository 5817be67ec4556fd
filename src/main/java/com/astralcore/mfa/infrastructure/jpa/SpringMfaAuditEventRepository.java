package com.astralcore.mfa.infrastructure.jpa;

import com.astralcore.mfa.domain.audit.RiskLevel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringMfaAuditEventRepository extends JpaRepository<MfaAuditEventEntity, UUID> {

    List<MfaAuditEventEntity> findByUserIdOrderByOccurredAtAsc(String userId);

    long countByUserIdAndAction(String userId, String action);

    long countByUserIdAndRiskLevel(String userId, RiskLevel riskLevel);
}
