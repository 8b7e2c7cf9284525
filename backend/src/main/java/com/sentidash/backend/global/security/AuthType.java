package com.sentidash.backend.global.security;

public enum AuthType {
    ANONYMOUS,
    AUTHENTICATED
}
