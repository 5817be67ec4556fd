package com.astralcore.mfa.exception;

import java.time.OffsetDateTime;

/**
 * Thrown while a lockout window is active. No code is evaluated.
 */
public class MfaLockedException extends MfaException {

    private final OffsetDateTime lockedUntil;

    public MfaLockedException(OffsetDateTime lockedUntil) {
        super("MFA_LOCKED", "Too many failed attempts. Try again after " + lockedUntil);
        this.lockedUntil = lockedUntil;
    }

    public OffsetDateTime getLockedUntil() {
        return lockedUntil;
    }
}
