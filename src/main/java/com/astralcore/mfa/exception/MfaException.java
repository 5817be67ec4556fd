package com.astralcore.mfa.exception;

/**
 * Base type of all MFA failures that abort a request. A wrong code is not one of them: it comes back as an
 * unsuccessful result.
 */
public abstract class MfaException extends RuntimeException {

    private final String errorCode;

    protected MfaException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected MfaException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
