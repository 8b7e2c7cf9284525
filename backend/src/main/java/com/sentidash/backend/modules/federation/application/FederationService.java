package com.sentidash.backend.modules.federation.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.sentidash.backend.global.common.LogMasking;
import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.global.security.AuthContext;
import com.sentidash.backend.modules.audit.application.SecurityAuditTrail;
import com.sentidash.backend.modules.auth.application.RoleEngine;
import com.sentidash.backend.modules.auth.application.SessionBundle;
import com.sentidash.backend.modules.auth.application.SessionManager;
import com.sentidash.backend.modules.auth.application.TokenCodec;
import com.sentidash.backend.modules.auth.application.UserAccountService;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.auth.domain.ProviderLink;
import com.sentidash.backend.modules.auth.domain.SessionRevocationReason;
import com.sentidash.backend.modules.federation.domain.FederationFlow;
import com.sentidash.backend.modules.federation.domain.LinkChoice;
import com.sentidash.backend.modules.federation.domain.PendingLinkDecision;
import com.sentidash.backend.modules.federation.infrastructure.persistence.PendingLinkDecisionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * OAuth 콜백을 하나의 {@link FederationFlow} 로 분류하고 실행한다.
 *
 * <p>분류 순서(먼저 맞는 것이 이긴다):
 * <ol>
 *   <li>subject 가 이미 연결됨: 다른 로그인 사용자면 충돌, 아니면 재방문</li>
 *   <li>로그인 사용자가 이미 OAuth 공급자를 가짐: 자동 연결</li>
 *   <li>공급자가 이메일을 검증하지 않음: 거절</li>
 *   <li>같은 이메일의 계정이 있음: 본인이거나 공급자가 도메인 권한자면 연결, 아니면 사용자 선택</li>
 *   <li>이메일만 쓰는 로그인 사용자와 이메일이 다름: 사용자 선택</li>
 *   <li>그 외: 신규 사용자(익명 사용자면 제자리 승급)</li>
 * </ol>
 *
 * <p>연결 이후 단계(인증 표시, 역할 승급)는 연결이 커밋된 뒤 실행되며 실패해도 로그인을 막지 않는다.
 */
@Service
public class FederationService {

    private static final Logger log = LoggerFactory.getLogger(FederationService.class);

    static final Duration DECISION_TTL = Duration.ofMinutes(10);
    private static final int DECISION_ID_BITS = 256;

    private final OAuthStateService oAuthStateService;
    private final OAuthProviderClient oAuthProviderClient;
    private final UserAccountService userAccountService;
    private final RoleEngine roleEngine;
    private final SessionManager sessionManager;
    private final PendingLinkDecisionRepository pendingLinkDecisionRepository;
    private final SecurityAuditTrail auditTrail;
    private final Clock clock;

    public FederationService(
            OAuthStateService oAuthStateService,
            OAuthProviderClient oAuthProviderClient,
            UserAccountService userAccountService,
            RoleEngine roleEngine,
            SessionManager sessionManager,
            PendingLinkDecisionRepository pendingLinkDecisionRepository,
            SecurityAuditTrail auditTrail,
            Clock clock
    ) {
        this.oAuthStateService = oAuthStateService;
        this.oAuthProviderClient = oAuthProviderClient;
        this.userAccountService = userAccountService;
        this.roleEngine = roleEngine;
        this.sessionManager = sessionManager;
        this.pendingLinkDecisionRepository = pendingLinkDecisionRepository;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    public FederationOutcome handleCallback(String providerCode, String code, String state, String redirectUri,
                                            AuthContext current, String deviceId) {
        IdentityProvider provider = IdentityProvider.fromOAuthCode(providerCode);
        oAuthStateService.consume(state, provider, redirectUri);
        OAuthIdentity identity = oAuthProviderClient.exchange(provider, code, redirectUri);
        if (identity.subject() == null || identity.subject().isBlank()) {
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "OAUTH_PROVIDER_UNAVAILABLE");
        }
        return federate(provider, identity, current, deviceId);
    }

    public FederationOutcome federate(IdentityProvider provider, OAuthIdentity identity, AuthContext current, String deviceId) {
        Decision decision = decide(provider, identity, current);
        log.info("Federation flow={} provider={} currentUser={} email={}", decision.flow(), provider.getCode(),
                current != null ? current.userId() : null, LogMasking.maskEmail(identity.email()));

        return switch (decision.flow()) {
            case RETURNING_USER -> {
                userAccountService.touchLastProvider(decision.userId(), provider);
                // 연결 당시 승급이 실패했더라도 여기서 다시 맞춘다. ANONYMOUS 가 아니면 아무 일도 없다
                roleEngine.advance(decision.userId(), "oauth:" + provider.getCode());
                yield signIn(FederationFlow.RETURNING_USER, decision.userId(), current, deviceId);
            }
            case PROVIDER_SUBJECT_COLLISION -> {
                auditTrail.userEvent("PROVIDER_SUBJECT_COLLISION", current.userId(), current.userId(),
                        Map.of("provider", provider.getCode()));
                throw new ProblemException(HttpStatus.CONFLICT, "ACCOUNT_ALREADY_LINKED");
            }
            case OAUTH_AUTO_LINK, EMAIL_VERIFIED_LINK -> {
                link(decision.userId(), provider, identity);
                yield signIn(decision.flow(), decision.userId(), current, deviceId);
            }
            case MANUAL_LINK_PROMPT -> FederationOutcome.prompt(openDecision(provider, identity, decision.userId()));
            case NEW_USER -> {
                UUID userId = createOrUpgrade(identity.email(), current);
                link(userId, provider, identity);
                yield signIn(FederationFlow.NEW_USER, userId, current, deviceId);
            }
        };
    }

    /**
     * 보류된 연결 결정을 한 번만 해소한다. LINK 는 후보 계정으로 로그인한 사용자만 선택할 수 있다.
     */
    public FederationOutcome resolveLinkDecision(String decisionId, LinkChoice choice, AuthContext current, String deviceId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PendingLinkDecision decision = pendingLinkDecisionRepository.findById(decisionId == null ? "" : decisionId)
                .filter(candidate -> candidate.isOpen(now))
                .orElseThrow(() -> new ProblemException(HttpStatus.BAD_REQUEST, "LINK_DECISION_INVALID"));

        if (choice == LinkChoice.LINK
                && (current == null || !current.isAuthenticated() || !decision.getCandidateUserId().equals(current.userId()))) {
            log.warn("Link decision LINK refused decisionId={} caller={}", decisionId, current != null ? current.userId() : null);
            throw new ProblemException(HttpStatus.FORBIDDEN, "FORBIDDEN");
        }
        if (pendingLinkDecisionRepository.resolve(decision.getDecisionId(), choice, now) == 0) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "LINK_DECISION_INVALID");
        }

        IdentityProvider provider = decision.getProvider();
        OAuthIdentity identity = new OAuthIdentity(decision.getSubject(), decision.getEmail(), decision.isEmailVerified());
        auditTrail.userEvent("LINK_DECISION_RESOLVED", decision.getCandidateUserId(),
                current != null ? current.userId() : null, Map.of("choice", choice.name(), "provider", provider.getCode()));

        return switch (choice) {
            case LINK -> {
                link(decision.getCandidateUserId(), provider, identity);
                yield signIn(FederationFlow.MANUAL_LINK_PROMPT, decision.getCandidateUserId(), current, deviceId);
            }
            case KEEP_SEPARATE -> {
                UUID userId = createSeparate(identity, current);
                link(userId, provider, identity);
                yield signIn(FederationFlow.MANUAL_LINK_PROMPT, userId, current, deviceId);
            }
        };
    }

    Decision decide(IdentityProvider provider, OAuthIdentity identity, AuthContext current) {
        boolean authenticated = current != null && current.isAuthenticated();

        Optional<ProviderLink> existing = userAccountService.findLink(provider, identity.subject());
        if (existing.isPresent()) {
            UUID ownerId = existing.get().getUser().getId();
            if (authenticated && !ownerId.equals(current.userId())) {
                return new Decision(FederationFlow.PROVIDER_SUBJECT_COLLISION, ownerId);
            }
            return new Decision(FederationFlow.RETURNING_USER, ownerId);
        }

        if (authenticated && userAccountService.hasOAuthProvider(current.userId())) {
            return new Decision(FederationFlow.OAUTH_AUTO_LINK, current.userId());
        }

        if (!identity.emailVerified() || identity.email() == null) {
            log.info("Unverified provider email rejected provider={}", provider.getCode());
            throw new ProblemException(HttpStatus.BAD_REQUEST, "EMAIL_NOT_VERIFIED");
        }

        Optional<AppUser> emailOwner = userAccountService.findByEmail(identity.email());
        if (emailOwner.isPresent()) {
            UUID ownerId = emailOwner.get().getId();
            boolean callerOwnsEmail = authenticated && ownerId.equals(current.userId());
            if (callerOwnsEmail || provider.isAuthoritativeFor(identity.email())) {
                return new Decision(FederationFlow.EMAIL_VERIFIED_LINK, ownerId);
            }
            return new Decision(FederationFlow.MANUAL_LINK_PROMPT, ownerId);
        }

        if (authenticated) {
            // 이메일 로그인만 쓰던 사용자가 다른 이메일의 OAuth 계정을 가져온 경우
            return new Decision(FederationFlow.MANUAL_LINK_PROMPT, current.userId());
        }
        return new Decision(FederationFlow.NEW_USER, null);
    }

    private void link(UUID userId, IdentityProvider provider, OAuthIdentity identity) {
        userAccountService.linkProvider(userId, provider, identity.subject(), identity.email());
        String assignedBy = "oauth:" + provider.getCode();
        if (identity.emailVerified() && identity.email() != null) {
            try {
                AppUser user = userAccountService.requireUser(userId);
                boolean ownedElsewhere = userAccountService.findByEmail(identity.email())
                        .map(owner -> !owner.getId().equals(userId))
                        .orElse(false);
                if (!user.isVerified() && !ownedElsewhere) {
                    userAccountService.markVerified(userId, identity.email(), assignedBy);
                }
            } catch (RuntimeException ex) {
                log.warn("Verification marking failed userId={} provider={}", userId, provider.getCode(), ex);
            }
        }
        roleEngine.advance(userId, assignedBy);
        auditTrail.userEvent("PROVIDER_LINKED", userId, userId, Map.of("provider", provider.getCode()));
    }

    private SessionBundle issue(UUID userId, AuthContext current, String deviceId) {
        if (current != null && Objects.equals(current.userId(), userId)) {
            sessionManager.revoke(current.sessionId(), SessionRevocationReason.SUPERSEDED);
        }
        return sessionManager.createSession(userId, deviceId);
    }

    private FederationOutcome signIn(FederationFlow flow, UUID userId, AuthContext current, String deviceId) {
        return FederationOutcome.signedIn(flow, issue(userId, current, deviceId));
    }

    private UUID createOrUpgrade(String email, AuthContext current) {
        if (current != null && current.isAnonymous()) {
            userAccountService.claimPrimaryEmail(current.userId(), email);
            return current.userId();
        }
        return userAccountService.createUser(email).getId();
    }

    private UUID createSeparate(OAuthIdentity identity, AuthContext current) {
        // 이메일이 다른 계정 소유이면 새 계정은 이메일 없이 만들고 공급자 메타데이터에만 남긴다
        boolean emailFree = identity.emailVerified() && identity.email() != null
                && userAccountService.findByEmail(identity.email()).isEmpty();
        String primaryEmail = emailFree ? identity.email() : null;
        if (current != null && current.isAnonymous()) {
            if (primaryEmail != null) {
                userAccountService.claimPrimaryEmail(current.userId(), primaryEmail);
            }
            return current.userId();
        }
        return userAccountService.createUser(primaryEmail).getId();
    }

    private PendingLinkDecision openDecision(IdentityProvider provider, OAuthIdentity identity, UUID candidateUserId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PendingLinkDecision decision = new PendingLinkDecision(
                TokenCodec.newRandomToken(DECISION_ID_BITS),
                provider,
                identity.subject(),
                AppUser.normalizeEmail(identity.email()),
                identity.emailVerified(),
                candidateUserId,
                now,
                now.plus(DECISION_TTL)
        );
        PendingLinkDecision saved = pendingLinkDecisionRepository.save(decision);
        auditTrail.userEvent("LINK_DECISION_OPENED", candidateUserId, null, Map.of("provider", provider.getCode()));
        return saved;
    }

    record Decision(FederationFlow flow, UUID userId) {
    }
}
