package com.sentidash.backend.modules.auth.domain;

import java.util.Locale;
import java.util.Set;

import org.springframework.http.HttpStatus;

import com.sentidash.backend.global.error.ProblemException;

public enum IdentityProvider {
    EMAIL("email", Set.of()),
    GOOGLE("google", Set.of("gmail.com")),
    GITHUB("github", Set.of());

    private final String code;
    private final Set<String> authoritativeDomains;

    IdentityProvider(String code, Set<String> authoritativeDomains) {
        this.code = code;
        this.authoritativeDomains = authoritativeDomains;
    }

    public String getCode() {
        return code;
    }

    public boolean isOAuth() {
        return this != EMAIL;
    }

    /**
     * 공급자가 해당 이메일 도메인의 발급 주체인지 여부. 이 경우에만 확인 없이 기존 계정에 연결한다.
     */
    public boolean isAuthoritativeFor(String email) {
        if (email == null) {
            return false;
        }
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) {
            return false;
        }
        return authoritativeDomains.contains(email.substring(at + 1).toLowerCase(Locale.ROOT));
    }

    public static IdentityProvider fromOAuthCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (IdentityProvider provider : values()) {
                if (provider.isOAuth() && provider.code.equals(normalized)) {
                    return provider;
                }
            }
        }
        throw new ProblemException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_PROVIDER");
    }
}
