package com.astralcore.mfa.exception;

/**
 * Exception thrown when setup is requested for a method the user already has enabled.
 */
public class MfaAlreadyConfiguredException extends MfaException {

    private static final String CODE = "MFA_ALREADY_CONFIGURED";

    /**
     * Constructs a new MFA already configured exception with the specified detail message.
     *
     * @param message the detail message
     */
    public MfaAlreadyConfiguredException(String message) {
        super(CODE, message);
    }

    /**
     * Constructs a new MFA already configured exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public MfaAlreadyConfiguredException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
