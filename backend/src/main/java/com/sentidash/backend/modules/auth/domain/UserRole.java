package com.sentidash.backend.modules.auth.domain;

import java.util.Arrays;
import java.util.List;

/**
 * 4단계 역할 계층. 선언 순서가 곧 서열이며 역할은 위로만 이동한다.
 */
public enum UserRole {
    ANONYMOUS,
    FREE,
    PAID,
    OPERATOR;

    public boolean isAtLeast(UserRole other) {
        return compareTo(other) >= 0;
    }

    public boolean isHigherThan(UserRole other) {
        return compareTo(other) > 0;
    }

    /** 자신과 그 아래 모든 역할. */
    public List<UserRole> impliedRoles() {
        return Arrays.stream(values())
                .filter(this::isAtLeast)
                .toList();
    }

    public List<UserRole> lowerRoles() {
        return Arrays.stream(values())
                .filter(this::isHigherThan)
                .toList();
    }
}
