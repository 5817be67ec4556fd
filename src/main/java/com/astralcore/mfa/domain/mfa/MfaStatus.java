// ==============================================================================
// MFA Status Enumeration
// File: src/main/java/com/astralcore/mfa/domain/mfa/MfaStatus.java
// ==============================================================================

package com.astralcore.mfa.domain.mfa;

/**
 * Lifecycle state of a single (user, method) MFA setting
 */
public enum MfaStatus {
    /**
     * Method was never set up, or has been switched off
     */
    DISABLED,

    /**
     * Setup was requested but no correct code has been presented yet
     */
    PENDING_SETUP,

    /**
     * Method is verified and active
     */
    ENABLED,

    /**
     * Method is suspended without losing its enrolment data
     */
    TEMPORARILY_DISABLED
}
