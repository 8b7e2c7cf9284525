package com.sentidash.backend.modules.magiclink.presentation.dto;

import java.time.OffsetDateTime;

public record MagicLinkAcceptedResponse(String status, OffsetDateTime expiresAt) {

    public static final String SENT = "SENT";
}
