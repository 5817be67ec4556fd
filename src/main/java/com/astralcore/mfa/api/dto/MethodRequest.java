package com.astralcore.mfa.api.dto;

import com.astralcore.mfa.domain.mfa.MfaMethod;
import jakarta.validation.constraints.NotNull;

/**
 * Body of the endpoints that only need to know which factor is meant.
 */
public record MethodRequest(
        @NotNull(message = "method is required")
        MfaMethod method
) {}
