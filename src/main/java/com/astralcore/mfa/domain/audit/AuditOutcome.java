package com.astralcore.mfa.domain.audit;

public enum AuditOutcome {
    SUCCESS,
    FAILURE
}
