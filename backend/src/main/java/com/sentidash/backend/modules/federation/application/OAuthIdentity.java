package com.sentidash.backend.modules.federation.application;

/**
 * 공급자가 확인해 준 신원. email 은 없을 수 있다.
 */
public record OAuthIdentity(String subject, String email, boolean emailVerified) {
}
