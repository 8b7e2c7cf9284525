package com.sentidash.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record RoleAssignmentResponse(UUID userId, String role, boolean changed) {
}
