package com.sentidash.backend.modules.federation.domain;

/**
 * OAuth 콜백이 귀결되는 흐름. 하나의 콜백은 정확히 하나의 흐름으로 분류된다.
 */
public enum FederationFlow {
    RETURNING_USER,
    PROVIDER_SUBJECT_COLLISION,
    OAUTH_AUTO_LINK,
    EMAIL_VERIFIED_LINK,
    MANUAL_LINK_PROMPT,
    NEW_USER
}
