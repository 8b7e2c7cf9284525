package com.sentidash.backend.modules.magiclink.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.sentidash.backend.global.common.LogMasking;
import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.global.error.RetryableProblemException;
import com.sentidash.backend.modules.audit.application.SecurityAuditTrail;
import com.sentidash.backend.modules.auth.application.RoleEngine;
import com.sentidash.backend.modules.auth.application.SessionBundle;
import com.sentidash.backend.modules.auth.application.SessionManager;
import com.sentidash.backend.modules.auth.application.TokenCodec;
import com.sentidash.backend.modules.auth.application.UserAccountService;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.magiclink.domain.MagicLinkToken;
import com.sentidash.backend.modules.magiclink.infrastructure.persistence.MagicLinkTokenRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 비밀번호 없는 이메일 로그인. 토큰 소비는 조건부 갱신으로 한 번만 성공한다.
 * 토큰 소비가 커밋된 뒤의 단계(인증 표시, 역할 승급)는 실패해도 로그인을 막지 않는다.
 */
@Service
public class MagicLinkService {

    private static final Logger log = LoggerFactory.getLogger(MagicLinkService.class);

    public static final String ASSIGNED_BY = "magic-link";
    private static final int TOKEN_BITS = 256;
    private static final Duration RATE_WINDOW = Duration.ofHours(1);

    private final MagicLinkTokenRepository magicLinkTokenRepository;
    private final MagicLinkMailer mailer;
    private final UserAccountService userAccountService;
    private final RoleEngine roleEngine;
    private final SessionManager sessionManager;
    private final SecurityAuditTrail auditTrail;
    private final Clock clock;
    private final Duration tokenTtl;
    private final int perEmailHourlyLimit;
    private final int perAddressHourlyLimit;
    private final String linkBaseUrl;

    public MagicLinkService(
            MagicLinkTokenRepository magicLinkTokenRepository,
            MagicLinkMailer mailer,
            UserAccountService userAccountService,
            RoleEngine roleEngine,
            SessionManager sessionManager,
            SecurityAuditTrail auditTrail,
            Clock clock,
            @Value("${auth.magic-link.ttl:PT1H}") Duration tokenTtl,
            @Value("${auth.magic-link.per-email-hourly-limit:5}") int perEmailHourlyLimit,
            @Value("${auth.magic-link.per-address-hourly-limit:20}") int perAddressHourlyLimit,
            @Value("${auth.magic-link.link-base-url}") String linkBaseUrl
    ) {
        this.magicLinkTokenRepository = magicLinkTokenRepository;
        this.mailer = mailer;
        this.userAccountService = userAccountService;
        this.roleEngine = roleEngine;
        this.sessionManager = sessionManager;
        this.auditTrail = auditTrail;
        this.clock = clock;
        this.tokenTtl = tokenTtl;
        this.perEmailHourlyLimit = perEmailHourlyLimit;
        this.perAddressHourlyLimit = perAddressHourlyLimit;
        this.linkBaseUrl = linkBaseUrl;
    }

    /**
     * 링크를 발급해 메일 협력자에 넘긴다. 계정 존재 여부와 무관하게 같은 응답을 돌려준다.
     */
    public MagicLinkIssued requestLink(String email, String sourceAddress, UUID anonymousUserId) {
        String normalizedEmail = AppUser.normalizeEmail(email);
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime windowStart = now.minus(RATE_WINDOW);

        if (magicLinkTokenRepository.countByEmailAndCreatedAtAfter(normalizedEmail, windowStart) >= perEmailHourlyLimit) {
            log.info("Magic link rate limited by email email={}", LogMasking.maskEmail(normalizedEmail));
            throw rateLimited(magicLinkTokenRepository
                    .findFirstByEmailAndCreatedAtAfterOrderByCreatedAtAsc(normalizedEmail, windowStart), now);
        }
        if (sourceAddress != null
                && magicLinkTokenRepository.countBySourceAddressAndCreatedAtAfter(sourceAddress, windowStart) >= perAddressHourlyLimit) {
            log.info("Magic link rate limited by address address={}", sourceAddress);
            throw rateLimited(magicLinkTokenRepository
                    .findFirstBySourceAddressAndCreatedAtAfterOrderByCreatedAtAsc(sourceAddress, windowStart), now);
        }

        String rawToken = TokenCodec.newRandomToken(TOKEN_BITS);
        String tokenHash = TokenCodec.sha256Hex(rawToken);
        OffsetDateTime expiresAt = now.plus(tokenTtl);
        magicLinkTokenRepository.save(new MagicLinkToken(tokenHash, normalizedEmail, sourceAddress, anonymousUserId, now, expiresAt));

        String link = UriComponentsBuilder.fromUriString(linkBaseUrl)
                .queryParam("token", rawToken)
                .build()
                .toUriString();
        try {
            mailer.send(normalizedEmail, link, expiresAt);
        } catch (RuntimeException ex) {
            log.error("Magic link delivery failed email={}", LogMasking.maskEmail(normalizedEmail), ex);
            discardUndelivered(tokenHash);
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "MAGIC_LINK_DELIVERY_FAILED", null, ex);
        }

        if (anonymousUserId != null) {
            markPendingQuietly(anonymousUserId, normalizedEmail);
        }
        log.info("Magic link issued email={} expiresAt={}", LogMasking.maskEmail(normalizedEmail), expiresAt);
        return new MagicLinkIssued(expiresAt);
    }

    /**
     * 링크를 소비하고 세션을 발급한다. 없거나 만료된 토큰은 400, 이미 사용된 토큰은 409.
     *
     * <p>소비는 별도로 커밋된다. 이후 사용자 확정, EMAIL 연결, 세션 생성 중 하나가 실패하면
     * 오류가 그대로 전파되고 토큰은 되살리지 않으므로 사용자는 새 링크를 요청해야 한다.
     * 검증 표시와 역할 승급 실패는 로그만 남기고 로그인을 막지 않는다.</p>
     */
    public SessionBundle verify(String rawToken, String clientAddress) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "MAGIC_LINK_INVALID");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        String tokenHash = TokenCodec.sha256Hex(rawToken.trim());
        MagicLinkToken token = magicLinkTokenRepository.findById(tokenHash)
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "MAGIC_LINK_INVALID"));
        if (token.isUsed()) {
            throw new ProblemException(HttpStatus.CONFLICT, "MAGIC_LINK_ALREADY_USED");
        }
        if (token.isExpired(now)) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "MAGIC_LINK_INVALID");
        }
        if (magicLinkTokenRepository.consume(tokenHash, now, clientAddress) == 0) {
            log.info("Magic link consumption lost email={}", LogMasking.maskEmail(token.getEmail()));
            throw new ProblemException(HttpStatus.CONFLICT, "MAGIC_LINK_ALREADY_USED");
        }

        UUID userId = resolveUser(token);
        userAccountService.linkProvider(userId, IdentityProvider.EMAIL, token.getEmail(), token.getEmail());
        markVerifiedQuietly(userId, token.getEmail());
        roleEngine.advance(userId, ASSIGNED_BY);

        auditTrail.userEvent("MAGIC_LINK_VERIFIED", userId, userId, Map.of("address", String.valueOf(clientAddress)));
        return sessionManager.createSession(userId, null);
    }

    private UUID resolveUser(MagicLinkToken token) {
        Optional<AppUser> owner = userAccountService.findByEmail(token.getEmail());
        if (owner.isPresent()) {
            return owner.get().getId();
        }
        if (token.getAnonymousUserId() != null) {
            Optional<AppUser> anonymous = findUpgradableAnonymous(token.getAnonymousUserId());
            if (anonymous.isPresent()) {
                userAccountService.claimPrimaryEmail(anonymous.get().getId(), token.getEmail());
                return anonymous.get().getId();
            }
        }
        return userAccountService.createUser(token.getEmail()).getId();
    }

    private Optional<AppUser> findUpgradableAnonymous(UUID userId) {
        try {
            AppUser user = userAccountService.requireUser(userId);
            if (user.getRole() == UserRole.ANONYMOUS && user.getPrimaryEmail() == null) {
                return Optional.of(user);
            }
        } catch (ProblemException ex) {
            log.info("Anonymous requester no longer exists userId={}", userId);
        }
        return Optional.empty();
    }

    private void markVerifiedQuietly(UUID userId, String email) {
        try {
            userAccountService.markVerified(userId, email, ASSIGNED_BY);
        } catch (RuntimeException ex) {
            log.warn("Verification marking failed userId={}", userId, ex);
        }
    }

    private void markPendingQuietly(UUID userId, String email) {
        try {
            userAccountService.markPending(userId, email);
        } catch (RuntimeException ex) {
            log.warn("Pending email marking failed userId={}", userId, ex);
        }
    }

    private void discardUndelivered(String tokenHash) {
        try {
            magicLinkTokenRepository.deleteById(tokenHash);
        } catch (RuntimeException cleanupFailure) {
            log.error("Undelivered magic link token cleanup failed", cleanupFailure);
        }
    }

    private RetryableProblemException rateLimited(Optional<MagicLinkToken> oldestInWindow, OffsetDateTime now) {
        long retryAfter = oldestInWindow
                .map(token -> Duration.between(now, token.getCreatedAt().plus(RATE_WINDOW)).getSeconds())
                .filter(seconds -> seconds > 0)
                .orElse(RATE_WINDOW.getSeconds());
        return new RetryableProblemException(HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", retryAfter);
    }

    public record MagicLinkIssued(OffsetDateTime expiresAt) {
    }
}
