package com.sentidash.backend.global.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.Set;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * 쿠키로 인증되는 상태 변경 요청에 double-submit CSRF 검사를 적용한다.
 * Bearer 헤더 요청은 브라우저가 자동으로 붙일 수 없으므로 검사하지 않는다.
 */
@Component
public class CsrfDoubleSubmitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CsrfDoubleSubmitFilter.class);

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");
    private static final Set<String> EXEMPT_PATHS = Set.of(
            "/auth/anonymous",
            "/auth/magic-link",
            "/auth/refresh",
            "/auth/oauth/callback"
    );

    private final ProblemResponseWriter problemResponseWriter;

    public CsrfDoubleSubmitFilter(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (requiresCheck(request) && !tokensMatch(request)) {
            log.warn("CSRF check failed method={} uri={}", request.getMethod(), request.getRequestURI());
            problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, "CSRF_TOKEN_INVALID", "CSRF_TOKEN_INVALID");
            return;
        }
        filterChain.doFilter(request, response);
    }

    private boolean requiresCheck(HttpServletRequest request) {
        if (SAFE_METHODS.contains(request.getMethod().toUpperCase())) {
            return false;
        }
        if (EXEMPT_PATHS.contains(request.getServletPath())) {
            return false;
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(JwtAuthenticationFilter.BEARER_PREFIX)) {
            return false;
        }
        return AuthCookies.read(request, AuthCookies.REFRESH_COOKIE).isPresent();
    }

    private boolean tokensMatch(HttpServletRequest request) {
        Optional<String> cookie = AuthCookies.read(request, AuthCookies.CSRF_COOKIE);
        String header = request.getHeader(AuthCookies.CSRF_HEADER);
        if (cookie.isEmpty() || header == null || header.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
                cookie.get().getBytes(StandardCharsets.UTF_8),
                header.getBytes(StandardCharsets.UTF_8)
        );
    }
}
