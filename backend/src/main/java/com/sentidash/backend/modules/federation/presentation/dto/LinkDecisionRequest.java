package com.sentidash.backend.modules.federation.presentation.dto;

import com.sentidash.backend.modules.federation.domain.LinkChoice;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LinkDecisionRequest(
        @NotBlank(message = "decisionId is required") String decisionId,
        @NotNull(message = "choice is required") LinkChoice choice,
        @Size(max = 200, message = "deviceId is too long") String deviceId
) {
}
