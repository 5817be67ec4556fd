package com.astralcore.mfa.exception;

/**
 * Thrown when caller input has the wrong shape, such as a phone number outside E.164 or a code of the wrong length.
 */
public class MfaValidationException extends MfaException {

    public MfaValidationException(String message) {
        super("MFA_VALIDATION_ERROR", message);
    }
}
