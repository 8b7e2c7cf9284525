package com.sentidash.backend.modules.federation.application;

import com.sentidash.backend.modules.auth.application.SessionBundle;
import com.sentidash.backend.modules.federation.domain.FederationFlow;
import com.sentidash.backend.modules.federation.domain.PendingLinkDecision;

/**
 * 세션이 발급되었거나(session) 사용자 선택이 필요하거나(pendingDecision) 둘 중 하나다.
 */
public record FederationOutcome(FederationFlow flow, SessionBundle session, PendingLinkDecision pendingDecision) {

    public static FederationOutcome signedIn(FederationFlow flow, SessionBundle session) {
        return new FederationOutcome(flow, session, null);
    }

    public static FederationOutcome prompt(PendingLinkDecision decision) {
        return new FederationOutcome(FederationFlow.MANUAL_LINK_PROMPT, null, decision);
    }

    public boolean requiresDecision() {
        return pendingDecision != null;
    }
}
