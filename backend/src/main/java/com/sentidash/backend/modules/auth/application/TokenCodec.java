package com.sentidash.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.Set;
import java.util.UUID;

import com.sentidash.backend.modules.auth.application.TokenValidationException.Reason;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.auth.infrastructure.jwt.SigningKeyRing;
import com.sentidash.backend.modules.auth.infrastructure.jwt.TokenKeyId;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.InvalidClaimException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwsHeader;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.LocatorAdapter;
import io.jsonwebtoken.security.SecurityException;
import io.jsonwebtoken.security.SignatureException;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 토큰 발급/검증. access(auth), anonymous(anon), refresh 세 경로가 각자의 키와 kid 로 서명된다.
 */
@Service
public class TokenCodec {

    static final String CLAIM_ROLE = "role";
    static final String CLAIM_REVOCATION = "rev";
    static final String CLAIM_SESSION = "sid";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final Base64.Encoder URL_ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SigningKeyRing keyRing;
    private final String issuer;
    private final String audience;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;
    private final JwtParser accessParser;
    private final JwtParser refreshParser;

    public TokenCodec(
            SigningKeyRing keyRing,
            @Value("${auth.jwt.issuer}") String issuer,
            @Value("${auth.jwt.audience}") String audience,
            @Value("${auth.jwt.leeway-seconds:60}") long leewaySeconds,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.keyRing = keyRing;
        this.issuer = issuer;
        this.audience = audience;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
        this.accessParser = buildParser(EnumSet.of(TokenKeyId.AUTH, TokenKeyId.ANON), leewaySeconds);
        this.refreshParser = buildParser(EnumSet.of(TokenKeyId.REFRESH), leewaySeconds);
    }

    public String issueAccessToken(UUID userId, UserRole role, UUID sessionId, String jti, long rev) {
        if (role == UserRole.ANONYMOUS) {
            throw new IllegalArgumentException("Anonymous users receive anonymous tokens");
        }
        return sign(TokenKeyId.AUTH, userId, role, sessionId, jti, rev, accessTokenTtlMillis);
    }

    public String issueAnonymousToken(UUID userId, UUID sessionId, String jti, long rev) {
        return sign(TokenKeyId.ANON, userId, null, sessionId, jti, rev, accessTokenTtlMillis);
    }

    public String issueRefreshToken(UUID userId, UUID sessionId, String refreshTokenId, long rev) {
        return sign(TokenKeyId.REFRESH, userId, null, sessionId, refreshTokenId, rev, refreshTokenTtlMillis);
    }

    public TokenClaims validateAccessToken(String token) {
        return parse(accessParser, token);
    }

    public TokenClaims validateRefreshToken(String token) {
        return parse(refreshParser, token);
    }

    public long getAccessTokenTtlMillis() {
        return accessTokenTtlMillis;
    }

    public long getRefreshTokenTtlMillis() {
        return refreshTokenTtlMillis;
    }

    /**
     * {@code bits} 비트 난수를 URL-safe Base64(패딩 없음)로 반환한다.
     */
    public static String newRandomToken(int bits) {
        if (bits <= 0 || bits % 8 != 0) {
            throw new IllegalArgumentException("bits must be a positive multiple of 8");
        }
        byte[] bytes = new byte[bits / 8];
        SECURE_RANDOM.nextBytes(bytes);
        return URL_ENCODER.encodeToString(bytes);
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private String sign(TokenKeyId keyId, UUID userId, UserRole role, UUID sessionId, String jti, long rev, long ttlMillis) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .header().keyId(keyId.kid()).and()
                .subject(userId.toString())
                .issuer(issuer)
                .audience().single(audience)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(ttlMillis)))
                .id(jti)
                .claim(CLAIM_REVOCATION, rev)
                .claim(CLAIM_SESSION, sessionId.toString());
        if (role != null) {
            builder.claim(CLAIM_ROLE, role.name());
        }
        return builder.signWith(keyRing.key(keyId), SIG.HS256).compact();
    }

    private TokenClaims parse(JwtParser parser, String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(Reason.MALFORMED, "Token is empty");
        }
        try {
            Jws<Claims> jws = parser.parseSignedClaims(token);
            TokenKeyId keyId = TokenKeyId.fromKid(jws.getHeader().getKeyId())
                    .orElseThrow(() -> new TokenValidationException(Reason.BAD_SIGNATURE, "Unknown key id"));
            return toClaims(jws.getPayload(), keyId);
        } catch (ExpiredJwtException e) {
            throw new TokenValidationException(Reason.EXPIRED, "Token expired", e);
        } catch (InvalidClaimException e) {
            throw new TokenValidationException(reasonForClaim(e.getClaimName()), "Invalid claim " + e.getClaimName(), e);
        } catch (SecurityException e) {
            throw new TokenValidationException(Reason.BAD_SIGNATURE, "Signature rejected", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenValidationException(Reason.MALFORMED, "Malformed token", e);
        }
    }

    private TokenClaims toClaims(Claims claims, TokenKeyId keyId) {
        UUID userId = UUID.fromString(claims.getSubject());
        Object sessionClaim = claims.get(CLAIM_SESSION);
        Object revocationClaim = claims.get(CLAIM_REVOCATION);
        if (!(sessionClaim instanceof String sid) || !(revocationClaim instanceof Number rev) || claims.getId() == null) {
            throw new TokenValidationException(Reason.MALFORMED, "Missing session claims");
        }
        UserRole role;
        if (keyId == TokenKeyId.AUTH) {
            String roleClaim = claims.get(CLAIM_ROLE, String.class);
            if (roleClaim == null) {
                throw new TokenValidationException(Reason.MALFORMED, "Missing role claim");
            }
            role = UserRole.valueOf(roleClaim);
        } else if (keyId == TokenKeyId.ANON) {
            role = UserRole.ANONYMOUS;
        } else {
            role = null;
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
        Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : null;
        return new TokenClaims(userId, role, UUID.fromString(sid), claims.getId(), rev.longValue(),
                issuedAt, expiresAt, keyId);
    }

    private static Reason reasonForClaim(String claimName) {
        if (Claims.ISSUER.equals(claimName)) {
            return Reason.WRONG_ISSUER;
        }
        if (Claims.AUDIENCE.equals(claimName)) {
            return Reason.WRONG_AUDIENCE;
        }
        return Reason.MALFORMED;
    }

    private JwtParser buildParser(Set<TokenKeyId> allowed, long leewaySeconds) {
        return Jwts.parser()
                .keyLocator(new AllowedKeyLocator(keyRing, allowed))
                .requireIssuer(issuer)
                .requireAudience(audience)
                .clockSkewSeconds(leewaySeconds)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    private static final class AllowedKeyLocator extends LocatorAdapter<Key> {

        private final SigningKeyRing keyRing;
        private final Set<TokenKeyId> allowed;

        private AllowedKeyLocator(SigningKeyRing keyRing, Set<TokenKeyId> allowed) {
            this.keyRing = keyRing;
            this.allowed = allowed;
        }

        @Override
        protected Key locate(JwsHeader header) {
            TokenKeyId keyId = TokenKeyId.fromKid(header.getKeyId())
                    .filter(allowed::contains)
                    .orElseThrow(() -> new SignatureException("Key id not accepted on this path"));
            return keyRing.key(keyId);
        }
    }
}
