package com.sentidash.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.global.security.AuthContext;
import com.sentidash.backend.global.security.AuthType;
import com.sentidash.backend.modules.audit.application.SecurityAuditTrail;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.SessionRevocationReason;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.auth.domain.UserSession;
import com.sentidash.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sentidash.backend.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    static final int TOKEN_ID_BITS = 256;
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;
    private final TokenCodec tokenCodec;
    private final SecurityAuditTrail auditTrail;
    private final Clock clock;
    private final int maxActiveSessions;

    public SessionManager(
            UserSessionRepository userSessionRepository,
            AppUserRepository appUserRepository,
            TokenCodec tokenCodec,
            SecurityAuditTrail auditTrail,
            Clock clock,
            @Value("${auth.session.max-active:5}") int maxActiveSessions
    ) {
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
        this.tokenCodec = tokenCodec;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.maxActiveSessions = maxActiveSessions;
    }

    /**
     * 새 세션을 만든다. 활성 세션이 이미 상한이면 가장 오래된 것(issuedAt 기준)부터 EVICTED 로 폐기한다.
     * 동시 생성 시 상한을 하나 넘길 수 있다(best effort).
     */
    @Transactional
    public SessionBundle createSession(UUID userId, String deviceId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        evictOverflow(userId, now);

        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));

        String refreshTokenId = TokenCodec.newRandomToken(TOKEN_ID_BITS);
        UserSession session = new UserSession();
        session.setUser(user);
        session.setDeviceId(normalizeDeviceId(deviceId));
        session.setIssuedAt(now);
        session.setAccessTokenExpiresAt(now.plusNanos(tokenCodec.getAccessTokenTtlMillis() * 1_000_000L));
        session.setRefreshExpiresAt(now.plusNanos(tokenCodec.getRefreshTokenTtlMillis() * 1_000_000L));
        session.setRefreshTokenId(refreshTokenId);
        session = userSessionRepository.save(session);

        String accessToken = issueAccess(user.getId(), user.getRole(), session.getId(), user.getRevocationId());
        String refreshToken = tokenCodec.issueRefreshToken(user.getId(), session.getId(), refreshTokenId, user.getRevocationId());
        session.setRefreshTokenHash(TokenCodec.sha256Hex(refreshToken));

        log.info("Session created userId={} sessionId={} role={}", user.getId(), session.getId(), user.getRole());
        return new SessionBundle(
                user.getId(),
                user.getRole(),
                authTypeOf(user.getRole()),
                session.getId(),
                accessToken,
                session.getAccessTokenExpiresAt(),
                refreshToken,
                session.getRefreshExpiresAt(),
                TokenCodec.newRandomToken(TOKEN_ID_BITS)
        );
    }

    /**
     * refresh token 을 한 번만 쓸 수 있게 회전한다. 동시 요청 중 조건부 교체에 이긴 쪽만 새 토큰을 받는다.
     */
    public SessionBundle rotateRefresh(String refreshToken) {
        TokenClaims claims;
        try {
            claims = tokenCodec.validateRefreshToken(refreshToken);
        } catch (TokenValidationException ex) {
            log.info("Refresh token rejected reason={}", ex.getReason());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findById(claims.sessionId())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));
        AppUser user = appUserRepository.findById(claims.userId())
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));
        if (!Objects.equals(session.getUser().getId(), user.getId())) {
            log.warn("Refresh token subject mismatch sessionId={} userId={}", session.getId(), claims.userId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        if (session.getRevokedAt() != null) {
            log.info("Refresh on revoked session sessionId={} reason={}", session.getId(), session.getRevokedReason());
            if (session.getRevokedReason() == SessionRevocationReason.EVICTED) {
                throw new ProblemException(HttpStatus.UNAUTHORIZED, "SESSION_EVICTED", "session evicted");
            }
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        if (!session.isActive(now)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        if (claims.revocationId() != user.getRevocationId()) {
            log.warn("Refresh token revocation id mismatch userId={} sessionId={}", user.getId(), session.getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        if (!Objects.equals(session.getRefreshTokenId(), claims.tokenId())) {
            log.warn("Stale refresh token presented userId={} sessionId={}", user.getId(), session.getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_REUSED");
        }
        if (session.getRefreshTokenHash() != null
                && !session.getRefreshTokenHash().equals(TokenCodec.sha256Hex(refreshToken))) {
            log.warn("Refresh token hash mismatch userId={} sessionId={}", user.getId(), session.getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        String newTokenId = TokenCodec.newRandomToken(TOKEN_ID_BITS);
        String newAccessToken = issueAccess(user.getId(), user.getRole(), session.getId(), user.getRevocationId());
        String newRefreshToken = tokenCodec.issueRefreshToken(user.getId(), session.getId(), newTokenId, user.getRevocationId());
        OffsetDateTime accessExpiresAt = now.plusNanos(tokenCodec.getAccessTokenTtlMillis() * 1_000_000L);
        OffsetDateTime refreshExpiresAt = now.plusNanos(tokenCodec.getRefreshTokenTtlMillis() * 1_000_000L);

        int updated = userSessionRepository.rotateRefreshToken(
                session.getId(),
                claims.tokenId(),
                newTokenId,
                TokenCodec.sha256Hex(newRefreshToken),
                now,
                accessExpiresAt,
                refreshExpiresAt
        );
        if (updated == 0) {
            log.warn("Concurrent refresh rotation lost userId={} sessionId={}", user.getId(), session.getId());
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_REUSED");
        }

        return new SessionBundle(
                user.getId(),
                user.getRole(),
                authTypeOf(user.getRole()),
                session.getId(),
                newAccessToken,
                accessExpiresAt,
                newRefreshToken,
                refreshExpiresAt,
                TokenCodec.newRandomToken(TOKEN_ID_BITS)
        );
    }

    /**
     * @return 이번 호출로 폐기되었으면 true. 이미 폐기된 세션이면 false.
     */
    public boolean revoke(UUID sessionId, SessionRevocationReason reason) {
        int updated = userSessionRepository.revokeIfActive(sessionId, OffsetDateTime.now(clock), reason);
        if (updated == 1) {
            log.info("Session revoked sessionId={} reason={}", sessionId, reason);
            auditTrail.sessionEvent("SESSION_REVOKED", sessionId, null, Map.of("reason", reason.name()));
        }
        return updated == 1;
    }

    /**
     * 사용자의 모든 세션을 폐기하고 revocationId 를 올려 이미 발급된 토큰도 무효화한다.
     */
    @Transactional
    public int revokeAllForUser(UUID userId, SessionRevocationReason reason) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int bumped = appUserRepository.incrementRevocationId(userId, now);
        if (bumped == 0) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND");
        }
        int revoked = userSessionRepository.revokeAllActive(userId, now, reason);
        log.info("All sessions revoked userId={} count={} reason={}", userId, revoked, reason);
        auditTrail.userEvent("SESSIONS_REVOKED_ALL", userId, null, Map.of("reason", reason.name(), "count", revoked));
        return revoked;
    }

    @Transactional(readOnly = true)
    public List<UserSession> listActiveSessions(UUID userId) {
        return userSessionRepository.findActiveSessions(userId, OffsetDateTime.now(clock));
    }

    public void signOut(AuthContext context) {
        revoke(context.sessionId(), SessionRevocationReason.LOGOUT);
    }

    /**
     * 쿠키만 가진 요청의 로그아웃. 유효하지 않은 토큰도 같은 결과로 끝내 토큰 유효 여부를 노출하지 않는다.
     */
    public void signOut(String refreshToken) {
        try {
            TokenClaims claims = tokenCodec.validateRefreshToken(refreshToken);
            revoke(claims.sessionId(), SessionRevocationReason.LOGOUT);
        } catch (TokenValidationException ex) {
            log.info("Sign-out with unusable refresh token reason={}", ex.getReason());
        }
    }

    private void evictOverflow(UUID userId, OffsetDateTime now) {
        List<UserSession> active = userSessionRepository.findActiveSessions(userId, now);
        int overflow = active.size() - maxActiveSessions + 1;
        for (int i = 0; i < overflow; i++) {
            UUID evictedId = active.get(i).getId();
            if (userSessionRepository.revokeIfActive(evictedId, now, SessionRevocationReason.EVICTED) == 1) {
                log.info("Session evicted userId={} sessionId={}", userId, evictedId);
                auditTrail.sessionEvent("SESSION_EVICTED", evictedId, userId, Map.of("reason", "EVICTED"));
            }
        }
    }

    private String issueAccess(UUID userId, UserRole role, UUID sessionId, long revocationId) {
        String jti = TokenCodec.newRandomToken(128);
        if (role == UserRole.ANONYMOUS) {
            return tokenCodec.issueAnonymousToken(userId, sessionId, jti, revocationId);
        }
        return tokenCodec.issueAccessToken(userId, role, sessionId, jti, revocationId);
    }

    private static AuthType authTypeOf(UserRole role) {
        return role == UserRole.ANONYMOUS ? AuthType.ANONYMOUS : AuthType.AUTHENTICATED;
    }

    private String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }
}
