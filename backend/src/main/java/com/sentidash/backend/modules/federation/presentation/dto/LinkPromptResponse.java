package com.sentidash.backend.modules.federation.presentation.dto;

import java.time.OffsetDateTime;

import com.sentidash.backend.global.common.LogMasking;
import com.sentidash.backend.modules.federation.domain.LinkChoice;
import com.sentidash.backend.modules.federation.domain.PendingLinkDecision;

/**
 * 선택지를 보여줄 뿐 기본값은 없다. 클라이언트는 choices 중 하나를 link-decision 으로 보내야 한다.
 */
public record LinkPromptResponse(
        String status,
        String decisionId,
        String provider,
        String maskedEmail,
        LinkChoice[] choices,
        OffsetDateTime expiresAt
) {
    public static final String LINK_DECISION_REQUIRED = "LINK_DECISION_REQUIRED";

    public static LinkPromptResponse from(PendingLinkDecision decision) {
        return new LinkPromptResponse(
                LINK_DECISION_REQUIRED,
                decision.getDecisionId(),
                decision.getProvider().getCode(),
                LogMasking.maskEmail(decision.getEmail()),
                LinkChoice.values(),
                decision.getExpiresAt()
        );
    }
}
