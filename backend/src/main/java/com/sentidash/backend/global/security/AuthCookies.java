package com.sentidash.backend.global.security;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * refresh_token(HttpOnly, Path=/auth) 과 csrf(스크립트에서 읽음, Path=/) 쿠키 쌍.
 * 프런트엔드가 다른 출처에 있으므로 둘 다 SameSite=None; Secure 이다.
 */
@Component
public class AuthCookies {

    public static final String REFRESH_COOKIE = "refresh_token";
    public static final String CSRF_COOKIE = "csrf";
    public static final String CSRF_HEADER = "X-CSRF-Token";

    private static final String REFRESH_PATH = "/auth";
    private static final String CSRF_PATH = "/";
    private static final String SAME_SITE = "None";

    private final boolean secure;

    public AuthCookies(@Value("${auth.cookies.secure:true}") boolean secure) {
        this.secure = secure;
    }

    public void write(HttpServletResponse response, String refreshToken, OffsetDateTime refreshExpiresAt,
                      String csrfToken, OffsetDateTime now) {
        Duration maxAge = Duration.between(now, refreshExpiresAt);
        if (maxAge.isNegative()) {
            maxAge = Duration.ZERO;
        }
        ResponseCookie refresh = ResponseCookie.from(REFRESH_COOKIE, refreshToken)
                .httpOnly(true)
                .secure(secure)
                .sameSite(SAME_SITE)
                .path(REFRESH_PATH)
                .maxAge(maxAge)
                .build();
        ResponseCookie csrf = ResponseCookie.from(CSRF_COOKIE, csrfToken)
                .httpOnly(false)
                .secure(secure)
                .sameSite(SAME_SITE)
                .path(CSRF_PATH)
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, refresh.toString());
        response.addHeader(HttpHeaders.SET_COOKIE, csrf.toString());
    }

    public void clear(HttpServletResponse response) {
        response.addHeader(HttpHeaders.SET_COOKIE, ResponseCookie.from(REFRESH_COOKIE, "")
                .httpOnly(true).secure(secure).sameSite(SAME_SITE).path(REFRESH_PATH).maxAge(0).build().toString());
        response.addHeader(HttpHeaders.SET_COOKIE, ResponseCookie.from(CSRF_COOKIE, "")
                .secure(secure).sameSite(SAME_SITE).path(CSRF_PATH).maxAge(0).build().toString());
    }

    public static Optional<String> read(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return Optional.of(cookie.getValue());
            }
        }
        return Optional.empty();
    }
}
