package com.sentidash.backend.modules.auth.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.sentidash.backend.global.security.AuthCookies;
import com.sentidash.backend.modules.auth.application.SessionBundle;
import com.sentidash.backend.modules.auth.presentation.dto.SessionResponse;

import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * 세션 발급 응답 공통 처리: 쿠키 쌍을 쓰고 본문에는 access token 만 싣는다.
 */
@Component
public class SessionResponses {

    private final AuthCookies authCookies;
    private final Clock clock;

    public SessionResponses(AuthCookies authCookies, Clock clock) {
        this.authCookies = authCookies;
        this.clock = clock;
    }

    public ResponseEntity<SessionResponse> issued(HttpServletResponse response, SessionBundle bundle, HttpStatus status) {
        authCookies.write(response, bundle.refreshToken(), bundle.refreshExpiresAt(), bundle.csrfToken(),
                OffsetDateTime.now(clock));
        return ResponseEntity.status(status).body(SessionResponse.from(bundle));
    }
}
