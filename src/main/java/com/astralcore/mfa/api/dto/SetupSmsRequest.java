package com.astralcore.mfa.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SetupSmsRequest(
        @NotBlank(message = "phoneNumber is required")
        String phoneNumber
) {}
