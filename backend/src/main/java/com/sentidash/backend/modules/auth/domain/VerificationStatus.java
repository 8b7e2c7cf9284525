package com.sentidash.backend.modules.auth.domain;

public enum VerificationStatus {
    NONE,
    PENDING,
    VERIFIED
}
