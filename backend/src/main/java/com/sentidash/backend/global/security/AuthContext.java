package com.sentidash.backend.global.security;

import java.util.UUID;

import com.sentidash.backend.modules.auth.domain.UserRole;

/**
 * 검증된 access token 으로부터 만든 요청 주체.
 */
public record AuthContext(UUID userId, UserRole role, UUID sessionId, AuthType authType) {

    public boolean isAuthenticated() {
        return authType == AuthType.AUTHENTICATED;
    }

    public boolean isAnonymous() {
        return authType == AuthType.ANONYMOUS;
    }
}
