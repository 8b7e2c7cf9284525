package com.sentidash.backend.modules.federation.presentation;

import com.sentidash.backend.global.security.AuthContext;
import com.sentidash.backend.global.security.SecurityUtils;
import com.sentidash.backend.modules.auth.presentation.SessionResponses;
import com.sentidash.backend.modules.federation.application.FederationOutcome;
import com.sentidash.backend.modules.federation.application.FederationService;
import com.sentidash.backend.modules.federation.application.OAuthStateService;
import com.sentidash.backend.modules.federation.presentation.dto.LinkDecisionRequest;
import com.sentidash.backend.modules.federation.presentation.dto.LinkPromptResponse;
import com.sentidash.backend.modules.federation.presentation.dto.OAuthCallbackRequest;
import com.sentidash.backend.modules.federation.presentation.dto.OAuthUrlsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FederationController {

    private final FederationService federationService;
    private final OAuthStateService oAuthStateService;
    private final SessionResponses sessionResponses;

    public FederationController(
            FederationService federationService,
            OAuthStateService oAuthStateService,
            SessionResponses sessionResponses
    ) {
        this.federationService = federationService;
        this.oAuthStateService = oAuthStateService;
        this.sessionResponses = sessionResponses;
    }

    @Operation(summary = "OAuth authorize URL", description = "공급자별로 일회용 state 가 포함된 authorize URL 을 돌려준다.")
    @GetMapping("/auth/oauth/urls")
    public OAuthUrlsResponse authorizationUrls(
            @Parameter(description = "공급자 로그인 후 돌아올 프런트엔드 콜백 주소")
            @RequestParam("redirectUri") String redirectUri
    ) {
        return new OAuthUrlsResponse(oAuthStateService.authorizationUrls(redirectUri));
    }

    @Operation(summary = "OAuth 콜백", description = "세션이 발급되면 200, 계정 연결 선택이 필요하면 202 와 결정 id 를 돌려준다.")
    @PostMapping("/auth/oauth/callback")
    public ResponseEntity<?> callback(@Valid @RequestBody OAuthCallbackRequest request, HttpServletResponse response) {
        AuthContext current = SecurityUtils.findCurrentContext().orElse(null);
        FederationOutcome outcome = federationService.handleCallback(
                request.provider(),
                request.code(),
                request.state(),
                request.redirectUri(),
                current,
                request.deviceId()
        );
        if (outcome.requiresDecision()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(LinkPromptResponse.from(outcome.pendingDecision()));
        }
        return sessionResponses.issued(response, outcome.session(), HttpStatus.OK);
    }

    @PostMapping("/auth/oauth/link-decision")
    public ResponseEntity<?> resolveLinkDecision(@Valid @RequestBody LinkDecisionRequest request, HttpServletResponse response) {
        AuthContext current = SecurityUtils.findCurrentContext().orElse(null);
        FederationOutcome outcome = federationService.resolveLinkDecision(
                request.decisionId(),
                request.choice(),
                current,
                request.deviceId()
        );
        return sessionResponses.issued(response, outcome.session(), HttpStatus.OK);
    }
}
