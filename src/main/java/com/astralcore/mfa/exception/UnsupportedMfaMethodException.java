package com.astralcore.mfa.exception;

import com.astralcore.mfa.domain.mfa.MfaMethod;

/**
 * Thrown when an operation is called with a method it does not apply to.
 */
public class UnsupportedMfaMethodException extends MfaException {

    public UnsupportedMfaMethodException(MfaMethod method, String operation) {
        super("MFA_UNSUPPORTED_METHOD", "Method " + method + " does not support " + operation);
    }
}
