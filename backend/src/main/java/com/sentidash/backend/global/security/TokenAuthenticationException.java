package com.sentidash.backend.global.security;

import org.springframework.security.core.AuthenticationException;

/**
 * access token 거절. code 는 응답에 그대로 노출되므로 TOKEN_EXPIRED, SESSION_EVICTED, INVALID_TOKEN 만 쓴다.
 */
public class TokenAuthenticationException extends AuthenticationException {

    private final String code;

    public TokenAuthenticationException(String code, String detail) {
        super(detail);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
