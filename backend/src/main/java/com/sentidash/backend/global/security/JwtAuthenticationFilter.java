package com.sentidash.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.auth.application.SessionStateVerifier;
import com.sentidash.backend.modules.auth.application.TokenClaims;
import com.sentidash.backend.modules.auth.application.TokenCodec;
import com.sentidash.backend.modules.auth.application.TokenValidationException;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Bearer access token 검증 후 AuthContext 를 principal 로 둔다.
 * 인증 유형은 토큰을 검증한 키로만 정해지며 요청 헤더(X-Auth-Type 등)는 보지 않는다.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    static final String BEARER_PREFIX = "Bearer ";

    // 토큰 없이(또는 만료된 토큰과 함께) 호출되는 경로
    private static final Set<String> TOKENLESS_PATHS = Set.of("/auth/anonymous", "/auth/refresh", "/auth/verify");

    private final TokenCodec tokenCodec;
    private final SessionStateVerifier sessionStateVerifier;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            TokenCodec tokenCodec,
            SessionStateVerifier sessionStateVerifier,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.tokenCodec = tokenCodec;
        this.sessionStateVerifier = sessionStateVerifier;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            try {
                TokenClaims claims = tokenCodec.validateAccessToken(token);
                sessionStateVerifier.verify(claims);

                AuthContext context = new AuthContext(claims.userId(), claims.role(), claims.sessionId(), claims.authType());
                List<SimpleGrantedAuthority> authorities = claims.role().impliedRoles().stream()
                        .map(role -> new SimpleGrantedAuthority("ROLE_" + role.name()))
                        .toList();

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(context, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (TokenValidationException ex) {
                SecurityContextHolder.clearContext();
                log.info("Access token rejected uri={} reason={}", request.getRequestURI(), ex.getReason());
                String code = ex.getReason() == TokenValidationException.Reason.EXPIRED ? "TOKEN_EXPIRED" : "INVALID_TOKEN";
                authenticationEntryPoint.commence(request, response, new TokenAuthenticationException(code, code));
                return;
            } catch (ProblemException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response,
                        new TokenAuthenticationException(ex.getCode(), ex.getDetailMessage()));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return TOKENLESS_PATHS.contains(request.getServletPath());
    }
}
