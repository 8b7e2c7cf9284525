package com.sentidash.backend.modules.auth.infrastructure.jwt;

import java.util.Optional;

/**
 * 서명 경로별 JWS kid. 인증 유형은 이 값(=검증에 사용된 키)으로만 결정된다.
 */
public enum TokenKeyId {
    AUTH("auth", "access"),
    ANON("anon", "anonymous"),
    REFRESH("refresh", "refresh");

    private final String kid;
    private final String derivationLabel;

    TokenKeyId(String kid, String derivationLabel) {
        this.kid = kid;
        this.derivationLabel = derivationLabel;
    }

    public String kid() {
        return kid;
    }

    String derivationLabel() {
        return derivationLabel;
    }

    public static Optional<TokenKeyId> fromKid(String kid) {
        for (TokenKeyId value : values()) {
            if (value.kid.equals(kid)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
