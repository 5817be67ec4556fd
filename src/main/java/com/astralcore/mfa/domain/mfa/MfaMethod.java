package com.astralcore.mfa.domain.mfa;

/**
 * Second factors a user can present.
 */
public enum MfaMethod {
    TOTP,
    SMS,
    EMAIL,
    /**
     * Single-use recovery codes. They are stored on the TOTP, SMS and EMAIL settings and never get a setting row of their own.
     */
    BACKUP_CODE;

    public boolean isChallengeBased() {
        return this == SMS || this == EMAIL;
    }
}
