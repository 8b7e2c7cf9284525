package com.sentidash.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Size;

public record DeviceRequest(
        @Size(max = 200, message = "deviceId is too long") String deviceId
) {
}
