package com.astralcore.mfa.api.dto;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record VerifySetupRequest(
        @NotNull(message = "method is required")
        MfaMethod method,

        @NotBlank(message = "code is required")
        String code
) {}
