package com.sentidash.backend.modules.auth.presentation.dto;

import java.util.List;
import java.util.UUID;

public record CurrentSessionResponse(
        UUID userId,
        String role,
        String authType,
        UUID sessionId,
        String primaryEmail,
        String verification,
        List<String> linkedProviders,
        String lastProviderUsed,
        String roleAssignedBy
) {
}
