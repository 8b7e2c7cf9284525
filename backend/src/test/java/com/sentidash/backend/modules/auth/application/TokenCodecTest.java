package com.sentidash.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;

import com.sentidash.backend.global.security.AuthType;
import com.sentidash.backend.modules.auth.application.TokenValidationException.Reason;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.auth.infrastructure.jwt.SigningKeyRing;
import com.sentidash.backend.modules.auth.infrastructure.jwt.TokenKeyId;

import io.jsonwebtoken.Jwts;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenCodecTest {

    private static final String SECRET = "unit-test-signing-secret-0123456789-abcdef";
    private static final String ISSUER = "https://auth.test";
    private static final String AUDIENCE = "api-test";
    private static final Instant NOW = Instant.parse("2025-03-01T09:00:00Z");

    private SigningKeyRing keyRing;
    private TokenCodec codec;

    private final UUID userId = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private final UUID sessionId = UUID.fromString("00000000-0000-0000-0000-0000000000a1");

    @BeforeEach
    void setUp() {
        keyRing = new SigningKeyRing(SECRET);
        codec = codecAt(NOW, ISSUER, AUDIENCE);
    }

    @Test
    @DisplayName("access token 은 역할과 세션 클레임을 그대로 돌려준다")
    void accessTokenCarriesClaims() {
        String token = codec.issueAccessToken(userId, UserRole.PAID, sessionId, "jti-1", 3L);

        TokenClaims claims = codec.validateAccessToken(token);

        assertThat(claims.userId()).isEqualTo(userId);
        assertThat(claims.role()).isEqualTo(UserRole.PAID);
        assertThat(claims.sessionId()).isEqualTo(sessionId);
        assertThat(claims.tokenId()).isEqualTo("jti-1");
        assertThat(claims.revocationId()).isEqualTo(3L);
        assertThat(claims.keyId()).isEqualTo(TokenKeyId.AUTH);
        assertThat(claims.authType()).isEqualTo(AuthType.AUTHENTICATED);
        assertThat(claims.expiresAt()).isEqualTo(NOW.plusMillis(codec.getAccessTokenTtlMillis()));
    }

    @Test
    @DisplayName("익명 토큰은 anon 키로 서명되고 ANONYMOUS 로 해석된다")
    void anonymousTokenIsAnonymous() {
        String token = codec.issueAnonymousToken(userId, sessionId, "jti-anon", 0L);

        TokenClaims claims = codec.validateAccessToken(token);

        assertThat(claims.keyId()).isEqualTo(TokenKeyId.ANON);
        assertThat(claims.role()).isEqualTo(UserRole.ANONYMOUS);
        assertThat(claims.authType()).isEqualTo(AuthType.ANONYMOUS);
    }

    @Test
    void anonymousRoleCannotReceiveAuthenticatedToken() {
        assertThatThrownBy(() -> codec.issueAccessToken(userId, UserRole.ANONYMOUS, sessionId, "jti", 0L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("refresh token 은 access 경로에서, access token 은 refresh 경로에서 거절된다")
    void tokensAreBoundToTheirPath() {
        String refresh = codec.issueRefreshToken(userId, sessionId, "rt-1", 0L);
        String access = codec.issueAccessToken(userId, UserRole.FREE, sessionId, "jti", 0L);

        assertThat(codec.validateRefreshToken(refresh).isRefresh()).isTrue();
        assertThatThrownBy(() -> codec.validateAccessToken(refresh))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.BAD_SIGNATURE));
        assertThatThrownBy(() -> codec.validateRefreshToken(access))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.BAD_SIGNATURE));
    }

    @Test
    @DisplayName("anon 키로 서명하고 kid 만 auth 로 바꾼 토큰은 서명 검증에 실패한다")
    void forgedKeyIdIsRejected() {
        String forged = Jwts.builder()
                .header().keyId(TokenKeyId.AUTH.kid()).and()
                .subject(userId.toString())
                .issuer(ISSUER)
                .audience().single(AUDIENCE)
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(600)))
                .id("jti")
                .claim(TokenCodec.CLAIM_ROLE, UserRole.OPERATOR.name())
                .claim(TokenCodec.CLAIM_REVOCATION, 0L)
                .claim(TokenCodec.CLAIM_SESSION, sessionId.toString())
                .signWith(keyRing.key(TokenKeyId.ANON), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> codec.validateAccessToken(forged))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.BAD_SIGNATURE));
    }

    @Test
    void expiredTokenBeyondLeewayIsRejected() {
        String token = codec.issueAccessToken(userId, UserRole.FREE, sessionId, "jti", 0L);
        TokenCodec later = codecAt(NOW.plusMillis(codec.getAccessTokenTtlMillis()).plus(Duration.ofSeconds(61)),
                ISSUER, AUDIENCE);

        assertThatThrownBy(() -> later.validateAccessToken(token))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.EXPIRED));
    }

    @Test
    void expiredTokenWithinLeewayIsAccepted() {
        String token = codec.issueAccessToken(userId, UserRole.FREE, sessionId, "jti", 0L);
        TokenCodec slightlyLater = codecAt(NOW.plusMillis(codec.getAccessTokenTtlMillis()).plus(Duration.ofSeconds(30)),
                ISSUER, AUDIENCE);

        assertThat(slightlyLater.validateAccessToken(token).userId()).isEqualTo(userId);
    }

    @Test
    void wrongAudienceAndIssuerAreRejected() {
        String token = codec.issueAccessToken(userId, UserRole.FREE, sessionId, "jti", 0L);

        assertThatThrownBy(() -> codecAt(NOW, ISSUER, "other-api").validateAccessToken(token))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.WRONG_AUDIENCE));
        assertThatThrownBy(() -> codecAt(NOW, "https://elsewhere", AUDIENCE).validateAccessToken(token))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.WRONG_ISSUER));
    }

    @Test
    void garbageIsMalformed() {
        assertThatThrownBy(() -> codec.validateAccessToken("not-a-jwt"))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.MALFORMED));
        assertThatThrownBy(() -> codec.validateAccessToken(" "))
                .isInstanceOfSatisfying(TokenValidationException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(Reason.MALFORMED));
    }

    @Test
    void randomTokensAreUrlSafeAndDistinct() {
        String first = TokenCodec.newRandomToken(256);
        String second = TokenCodec.newRandomToken(256);

        assertThat(first).hasSize(43).matches("[A-Za-z0-9_-]+");
        assertThat(first).isNotEqualTo(second);
        assertThat(TokenCodec.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    private TokenCodec codecAt(Instant instant, String issuer, String audience) {
        return new TokenCodec(keyRing, issuer, audience, 60, 900_000, 604_800_000,
                Clock.fixed(instant, ZoneOffset.UTC));
    }
}
