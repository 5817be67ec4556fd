package com.astralcore.mfa.exception;

public class MfaPermissionException extends MfaException {

    public MfaPermissionException(String message) {
        super("MFA_PERMISSION_DENIED", message);
    }
}
