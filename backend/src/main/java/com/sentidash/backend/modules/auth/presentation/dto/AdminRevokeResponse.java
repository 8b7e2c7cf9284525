package com.sentidash.backend.modules.auth.presentation.dto;

public record AdminRevokeResponse(int revokedSessions) {
}
