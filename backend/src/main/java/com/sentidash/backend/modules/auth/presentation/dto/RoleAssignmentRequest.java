package com.sentidash.backend.modules.auth.presentation.dto;

import com.sentidash.backend.modules.auth.domain.UserRole;

import jakarta.validation.constraints.NotNull;

public record RoleAssignmentRequest(
        @NotNull(message = "role is required") UserRole role
) {
}
