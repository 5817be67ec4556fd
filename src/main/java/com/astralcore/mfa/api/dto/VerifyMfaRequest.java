package com.astralcore.mfa.api.dto;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Login-time verification. {@code trustDevice} asks for a trust token that skips MFA on this device later.
 */
public record VerifyMfaRequest(
        @NotNull(message = "method is required")
        MfaMethod method,

        @NotBlank(message = "code is required")
        String code,

        boolean trustDevice
) {}
