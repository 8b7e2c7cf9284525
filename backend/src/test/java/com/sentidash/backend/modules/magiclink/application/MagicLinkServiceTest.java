package com.sentidash.backend.modules.magiclink.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.global.error.RetryableProblemException;
import com.sentidash.backend.global.security.AuthType;
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
import com.sentidash.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class MagicLinkServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");
    private static final String EMAIL = "reader@example.com";

    @Mock
    private MagicLinkTokenRepository magicLinkTokenRepository;

    @Mock
    private MagicLinkMailer mailer;

    @Mock
    private UserAccountService userAccountService;

    @Mock
    private RoleEngine roleEngine;

    @Mock
    private SessionManager sessionManager;

    @Mock
    private SecurityAuditTrail auditTrail;

    private MagicLinkService magicLinkService;
    private OffsetDateTime now;

    @BeforeEach
    void setUp() {
        now = OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC);
        magicLinkService = new MagicLinkService(
                magicLinkTokenRepository,
                mailer,
                userAccountService,
                roleEngine,
                sessionManager,
                auditTrail,
                Clock.fixed(NOW, ZoneOffset.UTC),
                Duration.ofHours(1),
                5,
                20,
                "https://app.example.com/auth/verify"
        );
    }

    @Test
    @DisplayName("링크에는 원문 토큰이, 저장소에는 해시만 들어간다")
    void requestLinkStoresOnlyHash() {
        when(magicLinkTokenRepository.countByEmailAndCreatedAtAfter(eq(EMAIL), any())).thenReturn(0L);
        when(magicLinkTokenRepository.countBySourceAddressAndCreatedAtAfter(eq("10.0.0.1"), any())).thenReturn(0L);

        MagicLinkService.MagicLinkIssued issued = magicLinkService.requestLink("  Reader@Example.com ", "10.0.0.1", null);

        ArgumentCaptor<MagicLinkToken> saved = ArgumentCaptor.forClass(MagicLinkToken.class);
        verify(magicLinkTokenRepository).save(saved.capture());
        ArgumentCaptor<String> link = ArgumentCaptor.forClass(String.class);
        verify(mailer).send(eq(EMAIL), link.capture(), eq(issued.expiresAt()));

        String rawToken = link.getValue().substring(link.getValue().indexOf("token=") + "token=".length());
        assertThat(link.getValue()).startsWith("https://app.example.com/auth/verify?token=");
        assertThat(saved.getValue().getTokenHash()).isEqualTo(TokenCodec.sha256Hex(rawToken));
        assertThat(saved.getValue().getTokenHash()).isNotEqualTo(rawToken);
        assertThat(issued.expiresAt()).isEqualTo(now.plusHours(1));
    }

    @Test
    @DisplayName("시간당 한도를 넘으면 Retry-After 와 함께 429")
    void requestLinkIsRateLimitedPerEmail() {
        when(magicLinkTokenRepository.countByEmailAndCreatedAtAfter(eq(EMAIL), any())).thenReturn(5L);
        MagicLinkToken oldest = new MagicLinkToken("h", EMAIL, null, null, now.minusMinutes(50), now.plusMinutes(10));
        when(magicLinkTokenRepository.findFirstByEmailAndCreatedAtAfterOrderByCreatedAtAsc(eq(EMAIL), any()))
                .thenReturn(Optional.of(oldest));

        assertThatThrownBy(() -> magicLinkService.requestLink(EMAIL, "10.0.0.1", null))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("RATE_LIMITED");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
                    assertThat(ex.getRetryAfterSeconds()).isEqualTo(600L);
                });
        verify(mailer, never()).send(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("메일 전송 실패 시 토큰을 지우고 503")
    void deliveryFailureDiscardsToken() {
        when(magicLinkTokenRepository.countByEmailAndCreatedAtAfter(eq(EMAIL), any())).thenReturn(0L);
        doThrow(new MagicLinkDeliveryException("smtp down", null)).when(mailer).send(anyString(), anyString(), any());

        assertThatThrownBy(() -> magicLinkService.requestLink(EMAIL, null, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MAGIC_LINK_DELIVERY_FAILED"));
        verify(magicLinkTokenRepository).deleteById(anyString());
    }

    @Test
    void anonymousRequesterIsMarkedPending() {
        UUID anonymousId = UUID.randomUUID();
        when(magicLinkTokenRepository.countByEmailAndCreatedAtAfter(eq(EMAIL), any())).thenReturn(0L);

        magicLinkService.requestLink(EMAIL, null, anonymousId);

        verify(userAccountService).markPending(anonymousId, EMAIL);
    }

    @Test
    void unknownTokenIsInvalid() {
        when(magicLinkTokenRepository.findById(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> magicLinkService.verify("nope", "10.0.0.1"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("MAGIC_LINK_INVALID");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                });
    }

    @Test
    void expiredTokenIsInvalid() {
        MagicLinkToken expired = new MagicLinkToken(TokenCodec.sha256Hex("raw"), EMAIL, null, null,
                now.minusHours(2), now.minusHours(1));
        when(magicLinkTokenRepository.findById(TokenCodec.sha256Hex("raw"))).thenReturn(Optional.of(expired));

        assertThatThrownBy(() -> magicLinkService.verify("raw", "10.0.0.1"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("MAGIC_LINK_INVALID"));
        verify(magicLinkTokenRepository, never()).consume(anyString(), any(), any());
    }

    @Test
    void usedTokenIsConflict() {
        MagicLinkToken used = liveToken(null);
        TestEntities.setField(used, "used", true);
        when(magicLinkTokenRepository.findById(used.getTokenHash())).thenReturn(Optional.of(used));

        assertThatThrownBy(() -> magicLinkService.verify("raw", "10.0.0.1"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("MAGIC_LINK_ALREADY_USED");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                });
    }

    @Test
    @DisplayName("처음 보는 이메일은 새 계정을 만들고 인증 표시 후 FREE 로 올린다")
    void verifyCreatesUserForNewEmail() {
        MagicLinkToken token = liveToken(null);
        UUID newUserId = UUID.randomUUID();
        when(magicLinkTokenRepository.findById(token.getTokenHash())).thenReturn(Optional.of(token));
        when(magicLinkTokenRepository.consume(eq(token.getTokenHash()), any(), eq("10.0.0.1"))).thenReturn(1);
        when(userAccountService.findByEmail(EMAIL)).thenReturn(Optional.empty());
        when(userAccountService.createUser(EMAIL)).thenReturn(TestEntities.user(newUserId, UserRole.ANONYMOUS));
        SessionBundle bundle = bundleFor(newUserId);
        when(sessionManager.createSession(newUserId, null)).thenReturn(bundle);

        SessionBundle result = magicLinkService.verify("raw", "10.0.0.1");

        assertThat(result).isSameAs(bundle);
        verify(userAccountService).linkProvider(newUserId, IdentityProvider.EMAIL, EMAIL, EMAIL);
        verify(userAccountService).markVerified(newUserId, EMAIL, MagicLinkService.ASSIGNED_BY);
        verify(roleEngine).advance(newUserId, MagicLinkService.ASSIGNED_BY);
    }

    @Test
    @DisplayName("익명 요청자는 제자리에서 승급된다")
    void verifyUpgradesAnonymousRequesterInPlace() {
        UUID anonymousId = UUID.randomUUID();
        MagicLinkToken token = liveToken(anonymousId);
        when(magicLinkTokenRepository.findById(token.getTokenHash())).thenReturn(Optional.of(token));
        when(magicLinkTokenRepository.consume(anyString(), any(), any())).thenReturn(1);
        when(userAccountService.findByEmail(EMAIL)).thenReturn(Optional.empty());
        when(userAccountService.requireUser(anonymousId)).thenReturn(TestEntities.user(anonymousId, UserRole.ANONYMOUS));
        when(sessionManager.createSession(anonymousId, null)).thenReturn(bundleFor(anonymousId));

        SessionBundle result = magicLinkService.verify("raw", "10.0.0.1");

        assertThat(result.userId()).isEqualTo(anonymousId);
        verify(userAccountService).claimPrimaryEmail(anonymousId, EMAIL);
        verify(userAccountService, never()).createUser(anyString());
    }

    @Test
    @DisplayName("인증 표시 실패는 로그인을 막지 않는다")
    void verificationMarkingFailureDoesNotBlockSignIn() {
        MagicLinkToken token = liveToken(null);
        AppUser owner = TestEntities.user(UUID.randomUUID(), UserRole.FREE);
        when(magicLinkTokenRepository.findById(token.getTokenHash())).thenReturn(Optional.of(token));
        when(magicLinkTokenRepository.consume(anyString(), any(), any())).thenReturn(1);
        when(userAccountService.findByEmail(EMAIL)).thenReturn(Optional.of(owner));
        doThrow(new IllegalStateException("db hiccup")).when(userAccountService)
                .markVerified(owner.getId(), EMAIL, MagicLinkService.ASSIGNED_BY);
        when(sessionManager.createSession(owner.getId(), null)).thenReturn(bundleFor(owner.getId()));

        SessionBundle result = magicLinkService.verify("raw", "10.0.0.1");

        assertThat(result.userId()).isEqualTo(owner.getId());
        verify(roleEngine).advance(owner.getId(), MagicLinkService.ASSIGNED_BY);
    }

    @Test
    @DisplayName("소비 뒤 세션 생성이 실패하면 오류를 전파하고 토큰은 되살리지 않는다")
    void sessionFailureAfterConsumeKeepsTokenUsed() {
        MagicLinkToken token = liveToken(null);
        AppUser owner = TestEntities.user(UUID.randomUUID(), UserRole.FREE);
        when(magicLinkTokenRepository.findById(token.getTokenHash())).thenReturn(Optional.of(token));
        when(magicLinkTokenRepository.consume(eq(token.getTokenHash()), any(), eq("10.0.0.1"))).thenReturn(1);
        when(userAccountService.findByEmail(EMAIL)).thenReturn(Optional.of(owner));
        when(sessionManager.createSession(owner.getId(), null)).thenThrow(new IllegalStateException("store down"));

        assertThatThrownBy(() -> magicLinkService.verify("raw", "10.0.0.1"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("store down");

        verify(magicLinkTokenRepository).findById(token.getTokenHash());
        verify(magicLinkTokenRepository).consume(eq(token.getTokenHash()), any(), eq("10.0.0.1"));
        verifyNoMoreInteractions(magicLinkTokenRepository);
    }

    @Test
    @DisplayName("같은 링크를 동시에 열면 정확히 한 요청만 세션을 받는다")
    void concurrentVerificationSucceedsOnce() throws Exception {
        MagicLinkToken token = liveToken(null);
        AppUser owner = TestEntities.user(UUID.randomUUID(), UserRole.FREE);
        AtomicBoolean consumed = new AtomicBoolean(false);
        when(magicLinkTokenRepository.findById(token.getTokenHash())).thenReturn(Optional.of(token));
        when(magicLinkTokenRepository.consume(anyString(), any(), any()))
                .thenAnswer(invocation -> consumed.compareAndSet(false, true) ? 1 : 0);
        lenient().when(userAccountService.findByEmail(EMAIL)).thenReturn(Optional.of(owner));
        lenient().when(sessionManager.createSession(owner.getId(), null)).thenReturn(bundleFor(owner.getId()));

        int attempts = 8;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                Callable<Boolean> attempt = () -> {
                    start.await();
                    try {
                        magicLinkService.verify("raw", "10.0.0.1");
                        return true;
                    } catch (ProblemException ex) {
                        assertThat(ex.getCode()).isEqualTo("MAGIC_LINK_ALREADY_USED");
                        return false;
                    }
                };
                results.add(executor.submit(attempt));
            }
            start.countDown();
            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
        verify(sessionManager, times(1)).createSession(owner.getId(), null);
    }

    private MagicLinkToken liveToken(UUID anonymousUserId) {
        return new MagicLinkToken(TokenCodec.sha256Hex("raw"), EMAIL, "10.0.0.1", anonymousUserId,
                now.minusMinutes(5), now.plusMinutes(55));
    }

    private SessionBundle bundleFor(UUID userId) {
        return new SessionBundle(userId, UserRole.FREE, AuthType.AUTHENTICATED, UUID.randomUUID(), "access",
                now.plusMinutes(15), "refresh", now.plusDays(7), "csrf");
    }
}
