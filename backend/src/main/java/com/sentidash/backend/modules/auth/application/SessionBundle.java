package com.sentidash.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sentidash.backend.global.security.AuthType;
import com.sentidash.backend.modules.auth.domain.UserRole;

/**
 * 세션 발급/회전 결과. refresh token 과 CSRF 값은 쿠키로만 내려간다.
 */
public record SessionBundle(
        UUID userId,
        UserRole role,
        AuthType authType,
        UUID sessionId,
        String accessToken,
        OffsetDateTime accessTokenExpiresAt,
        String refreshToken,
        OffsetDateTime refreshExpiresAt,
        String csrfToken
) {
}
