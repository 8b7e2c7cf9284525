package com.sentidash.backend.modules.auth.application;

import java.util.List;
import java.util.Map;

import com.sentidash.backend.global.security.AuthContext;
import com.sentidash.backend.modules.audit.application.SecurityAuditTrail;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.auth.domain.ProviderLink;

import org.springframework.stereotype.Service;

/**
 * 익명 세션 부트스트랩과 현재 세션 조회.
 */
@Service
public class AuthService {

    private final UserAccountService userAccountService;
    private final SessionManager sessionManager;
    private final SecurityAuditTrail auditTrail;

    public AuthService(UserAccountService userAccountService, SessionManager sessionManager, SecurityAuditTrail auditTrail) {
        this.userAccountService = userAccountService;
        this.sessionManager = sessionManager;
        this.auditTrail = auditTrail;
    }

    public SessionBundle bootstrapAnonymous(String deviceId) {
        AppUser user = userAccountService.createAnonymousUser();
        SessionBundle bundle = sessionManager.createSession(user.getId(), deviceId);
        auditTrail.userEvent("ANONYMOUS_BOOTSTRAP", user.getId(), user.getId(), Map.of("sessionId", bundle.sessionId().toString()));
        return bundle;
    }

    public CurrentSession describe(AuthContext context) {
        AppUser user = userAccountService.requireUser(context.userId());
        List<IdentityProvider> providers = userAccountService.findLinks(user.getId()).stream()
                .map(ProviderLink::getProvider)
                .toList();
        return new CurrentSession(context, user, providers);
    }

    public record CurrentSession(AuthContext context, AppUser user, List<IdentityProvider> linkedProviders) {
    }
}
