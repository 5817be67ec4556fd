package com.astralcore.mfa.domain.audit;

public enum AuditCategory {
    ENROLLMENT,
    VERIFICATION,
    FAILURE,
    DISABLEMENT
}
