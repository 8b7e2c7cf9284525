package com.sentidash.backend.modules.auth.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.AssertTrue;

public record AdminRevokeRequest(UUID sessionId, UUID userId) {

    @AssertTrue(message = "exactly one of sessionId or userId is required")
    public boolean isSingleTarget() {
        return (sessionId == null) != (userId == null);
    }
}
