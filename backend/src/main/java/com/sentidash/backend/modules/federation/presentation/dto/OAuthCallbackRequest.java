package com.sentidash.backend.modules.federation.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record OAuthCallbackRequest(
        @NotBlank(message = "provider is required") String provider,
        @NotBlank(message = "code is required") String code,
        @NotBlank(message = "state is required") String state,
        @NotBlank(message = "redirectUri is required") String redirectUri,
        @Size(max = 200, message = "deviceId is too long") String deviceId
) {
}
