package com.sentidash.backend.modules.auth.application;

import java.time.Instant;
import java.util.UUID;

import com.sentidash.backend.global.security.AuthType;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.auth.infrastructure.jwt.TokenKeyId;

public record TokenClaims(
        UUID userId,
        UserRole role,
        UUID sessionId,
        String tokenId,
        long revocationId,
        Instant issuedAt,
        Instant expiresAt,
        TokenKeyId keyId
) {

    public AuthType authType() {
        return keyId == TokenKeyId.ANON ? AuthType.ANONYMOUS : AuthType.AUTHENTICATED;
    }

    public boolean isRefresh() {
        return keyId == TokenKeyId.REFRESH;
    }
}
