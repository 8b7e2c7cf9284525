package com.sentidash.backend.modules.magiclink.presentation;

import java.util.UUID;

import com.sentidash.backend.global.security.AuthContext;
import com.sentidash.backend.global.security.SecurityUtils;
import com.sentidash.backend.global.web.ClientAddressResolver;
import com.sentidash.backend.modules.auth.application.SessionBundle;
import com.sentidash.backend.modules.auth.presentation.SessionResponses;
import com.sentidash.backend.modules.auth.presentation.dto.SessionResponse;
import com.sentidash.backend.modules.magiclink.application.MagicLinkService;
import com.sentidash.backend.modules.magiclink.application.MagicLinkService.MagicLinkIssued;
import com.sentidash.backend.modules.magiclink.presentation.dto.MagicLinkAcceptedResponse;
import com.sentidash.backend.modules.magiclink.presentation.dto.MagicLinkRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.servlet.http.HttpServletRequest;
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
public class MagicLinkController {

    private final MagicLinkService magicLinkService;
    private final SessionResponses sessionResponses;

    public MagicLinkController(MagicLinkService magicLinkService, SessionResponses sessionResponses) {
        this.magicLinkService = magicLinkService;
        this.sessionResponses = sessionResponses;
    }

    @Operation(summary = "매직 링크 요청", description = "계정 존재 여부와 관계없이 같은 202 응답을 준다. 시간당 이메일/주소별 한도를 넘으면 429.")
    @PostMapping("/auth/magic-link")
    public ResponseEntity<MagicLinkAcceptedResponse> request(
            @Valid @RequestBody MagicLinkRequest request,
            HttpServletRequest httpRequest
    ) {
        UUID anonymousUserId = SecurityUtils.findCurrentContext()
                .filter(AuthContext::isAnonymous)
                .map(AuthContext::userId)
                .orElse(null);
        MagicLinkIssued issued = magicLinkService.requestLink(
                request.email(),
                ClientAddressResolver.resolve(httpRequest),
                anonymousUserId
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new MagicLinkAcceptedResponse(MagicLinkAcceptedResponse.SENT, issued.expiresAt()));
    }

    @Operation(summary = "매직 링크 검증", description = "토큰을 한 번만 소비하고 세션을 발급한다.")
    @GetMapping("/auth/verify")
    public ResponseEntity<SessionResponse> verify(
            @RequestParam("token") String token,
            HttpServletRequest httpRequest,
            HttpServletResponse response
    ) {
        SessionBundle bundle = magicLinkService.verify(token, ClientAddressResolver.resolve(httpRequest));
        return sessionResponses.issued(response, bundle, HttpStatus.OK);
    }
}
