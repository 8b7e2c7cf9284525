package com.sentidash.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ActiveSessionResponse(
        UUID sessionId,
        String deviceId,
        OffsetDateTime issuedAt,
        OffsetDateTime lastRotatedAt,
        OffsetDateTime refreshExpiresAt,
        boolean current
) {
}
