package com.sentidash.backend.modules.auth.presentation.dto;

/**
 * 쿠키를 쓸 수 없는 클라이언트용 본문 fallback.
 */
public record RefreshRequest(String refreshToken) {
}
