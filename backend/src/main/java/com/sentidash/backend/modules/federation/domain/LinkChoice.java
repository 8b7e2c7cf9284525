package com.sentidash.backend.modules.federation.domain;

public enum LinkChoice {
    LINK,
    KEEP_SEPARATE
}
