package com.astralcore.mfa.exception;

/**
 * Thrown when the requested operation needs a pending or enabled setting that does not exist.
 */
public class MfaNotFoundException extends MfaException {

    public MfaNotFoundException(String message) {
        super("MFA_NOT_FOUND", message);
    }
}
