package com.sentidash.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sentidash.backend.modules.auth.application.SessionBundle;

/**
 * refresh token 은 쿠키로만 전달되므로 본문에 포함하지 않는다.
 */
public record SessionResponse(
        UUID userId,
        String role,
        String authType,
        UUID sessionId,
        String accessToken,
        String tokenType,
        OffsetDateTime accessTokenExpiresAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static SessionResponse from(SessionBundle bundle) {
        return new SessionResponse(
                bundle.userId(),
                bundle.role().name(),
                bundle.authType().name(),
                bundle.sessionId(),
                bundle.accessToken(),
                DEFAULT_TOKEN_TYPE,
                bundle.accessTokenExpiresAt()
        );
    }
}
