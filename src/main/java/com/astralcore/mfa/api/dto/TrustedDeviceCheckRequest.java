package com.astralcore.mfa.api.dto;

import jakarta.validation.constraints.NotBlank;

public record TrustedDeviceCheckRequest(
        @NotBlank(message = "token is required")
        String token
) {}
