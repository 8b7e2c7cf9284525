package com.sentidash.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.EnumMap;
import java.util.Map;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import io.jsonwebtoken.security.Keys;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 마스터 시크릿에서 서명 경로별 HMAC 키를 파생한다.
 * 경로마다 키가 다르므로 한 경로의 토큰은 다른 경로에서 서명 검증을 통과할 수 없다.
 */
@Component
public class SigningKeyRing {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final Map<TokenKeyId, SecretKey> keys = new EnumMap<>(TokenKeyId.class);

    public SigningKeyRing(@Value("${jwt.secret}") String secretString) {
        byte[] master;
        try {
            master = Base64.getDecoder().decode(secretString);
        } catch (IllegalArgumentException ex) {
            master = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (master.length == 0) {
            throw new IllegalStateException("jwt.secret must not be empty");
        }
        for (TokenKeyId keyId : TokenKeyId.values()) {
            keys.put(keyId, Keys.hmacShaKeyFor(derive(master, keyId.derivationLabel())));
        }
    }

    public SecretKey key(TokenKeyId keyId) {
        return keys.get(keyId);
    }

    private static byte[] derive(byte[] master, String label) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA_256);
            mac.init(new SecretKeySpec(master, HMAC_SHA_256));
            return mac.doFinal(label.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to derive signing key", e);
        }
    }
}
