package com.astralcore.mfa.domain.audit;

/**
 * Severity attached to each audit event
 */
public enum RiskLevel {
    /** Routine successful verification */
    LOW,
    /** Setup and administrative changes */
    MEDIUM,
    /** Failures, lockouts and disablement */
    HIGH,
    /** Integrity incidents such as a ciphertext that fails authentication */
    CRITICAL
}
