package com.sentidash.backend.modules.auth.domain;

public enum SessionRevocationReason {
    EVICTED,
    LOGOUT,
    ADMIN_REVOKED,
    USER_REVOKED_ALL,
    SUPERSEDED,
    EXPIRED
}
