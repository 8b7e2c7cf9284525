package com.sentidash.backend.modules.auth.application;

import java.util.Objects;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.auth.domain.SessionRevocationReason;
import com.sentidash.backend.modules.auth.domain.UserSession;
import com.sentidash.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sentidash.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * 서명이 유효한 access token 이라도 세션이 폐기되었거나 revocationId 가 바뀌었으면 거절한다.
 */
@Component
public class SessionStateVerifier {

    private static final Logger log = LoggerFactory.getLogger(SessionStateVerifier.class);

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;

    public SessionStateVerifier(UserSessionRepository userSessionRepository, AppUserRepository appUserRepository) {
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
    }

    public void verify(TokenClaims claims) {
        UserSession session = userSessionRepository.findById(claims.sessionId())
                .orElseThrow(() -> rejected("session not found", claims));
        if (!Objects.equals(session.getUser().getId(), claims.userId())) {
            throw rejected("session owner mismatch", claims);
        }
        if (session.getRevokedAt() != null) {
            if (session.getRevokedReason() == SessionRevocationReason.EVICTED) {
                log.info("Access with evicted session userId={} sessionId={}", claims.userId(), claims.sessionId());
                throw new ProblemException(HttpStatus.UNAUTHORIZED, "SESSION_EVICTED", "session evicted");
            }
            throw rejected("session revoked " + session.getRevokedReason(), claims);
        }
        long currentRevocationId = appUserRepository.findRevocationId(claims.userId())
                .orElseThrow(() -> rejected("user not found", claims));
        if (currentRevocationId != claims.revocationId()) {
            throw rejected("revocation id mismatch", claims);
        }
    }

    private ProblemException rejected(String reason, TokenClaims claims) {
        log.warn("Access token rejected reason={} userId={} sessionId={}", reason, claims.userId(), claims.sessionId());
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_TOKEN");
    }
}
