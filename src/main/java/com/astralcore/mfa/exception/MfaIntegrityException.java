package com.astralcore.mfa.exception;

/**
 * Thrown when stored ciphertext cannot be authenticated or decoded. Treated as a security incident; the message is
 * never shown to end users.
 */
public class MfaIntegrityException extends MfaException {

    public MfaIntegrityException(String message) {
        super("MFA_INTEGRITY_ERROR", message);
    }

    public MfaIntegrityException(String message, Throwable cause) {
        super("MFA_INTEGRITY_ERROR", message, cause);
    }
}
