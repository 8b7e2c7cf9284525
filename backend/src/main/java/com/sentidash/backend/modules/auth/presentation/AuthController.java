package com.sentidash.backend.modules.auth.presentation;

import java.util.List;
import java.util.Objects;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.global.security.AuthContext;
import com.sentidash.backend.global.security.AuthCookies;
import com.sentidash.backend.global.security.SecurityUtils;
import com.sentidash.backend.modules.auth.application.AuthService;
import com.sentidash.backend.modules.auth.application.AuthService.CurrentSession;
import com.sentidash.backend.modules.auth.application.SessionBundle;
import com.sentidash.backend.modules.auth.application.SessionManager;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.presentation.dto.ActiveSessionResponse;
import com.sentidash.backend.modules.auth.presentation.dto.CurrentSessionResponse;
import com.sentidash.backend.modules.auth.presentation.dto.DeviceRequest;
import com.sentidash.backend.modules.auth.presentation.dto.RefreshRequest;
import com.sentidash.backend.modules.auth.presentation.dto.SessionResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;
    private final SessionManager sessionManager;
    private final SessionResponses sessionResponses;
    private final AuthCookies authCookies;

    public AuthController(
            AuthService authService,
            SessionManager sessionManager,
            SessionResponses sessionResponses,
            AuthCookies authCookies
    ) {
        this.authService = authService;
        this.sessionManager = sessionManager;
        this.sessionResponses = sessionResponses;
        this.authCookies = authCookies;
    }

    @Operation(summary = "익명 세션 발급", description = "익명 사용자를 만들고 anonymous access token 과 refresh/csrf 쿠키를 발급한다.")
    @PostMapping("/auth/anonymous")
    public ResponseEntity<SessionResponse> anonymous(
            @Valid @RequestBody(required = false) DeviceRequest request,
            HttpServletResponse response
    ) {
        String deviceId = request != null ? request.deviceId() : null;
        SessionBundle bundle = authService.bootstrapAnonymous(deviceId);
        return sessionResponses.issued(response, bundle, HttpStatus.CREATED);
    }

    @Operation(summary = "토큰 회전", description = "refresh_token 쿠키(또는 본문)를 한 번만 사용할 수 있는 새 토큰 쌍으로 교체한다.")
    @PostMapping("/auth/refresh")
    public ResponseEntity<SessionResponse> refresh(
            @RequestBody(required = false) RefreshRequest request,
            HttpServletRequest httpRequest,
            HttpServletResponse response
    ) {
        String refreshToken = AuthCookies.read(httpRequest, AuthCookies.REFRESH_COOKIE)
                .orElse(request != null ? request.refreshToken() : null);
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }
        SessionBundle bundle = sessionManager.rotateRefresh(refreshToken);
        return sessionResponses.issued(response, bundle, HttpStatus.OK);
    }

    @PostMapping("/auth/signout")
    public ResponseEntity<Void> signOut(HttpServletRequest httpRequest, HttpServletResponse response) {
        SecurityUtils.findCurrentContext().ifPresentOrElse(
                sessionManager::signOut,
                () -> AuthCookies.read(httpRequest, AuthCookies.REFRESH_COOKIE).ifPresent(sessionManager::signOut)
        );
        authCookies.clear(response);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/auth/session")
    public ResponseEntity<CurrentSessionResponse> session() {
        CurrentSession current = authService.describe(SecurityUtils.getCurrentContext());
        AppUser user = current.user();
        AuthContext context = current.context();
        return ResponseEntity.ok(new CurrentSessionResponse(
                user.getId(),
                user.getRole().name(),
                context.authType().name(),
                context.sessionId(),
                user.getPrimaryEmail(),
                user.getVerification().name(),
                current.linkedProviders().stream().map(provider -> provider.getCode()).toList(),
                user.getLastProviderUsed() != null ? user.getLastProviderUsed().getCode() : null,
                user.getRoleAssignedBy()
        ));
    }

    @Operation(summary = "내 활성 세션 목록", description = "폐기되지 않은 세션을 발급 순으로 보여준다.")
    @GetMapping("/auth/sessions")
    public List<ActiveSessionResponse> sessions() {
        AuthContext context = SecurityUtils.getCurrentContext();
        return sessionManager.listActiveSessions(context.userId()).stream()
                .map(session -> new ActiveSessionResponse(
                        session.getId(),
                        session.getDeviceId(),
                        session.getIssuedAt(),
                        session.getLastRotatedAt(),
                        session.getRefreshExpiresAt(),
                        Objects.equals(session.getId(), context.sessionId())
                ))
                .toList();
    }
}
