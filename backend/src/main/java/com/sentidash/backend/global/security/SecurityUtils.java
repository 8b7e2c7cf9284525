package com.sentidash.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.server.ResponseStatusException;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<AuthContext> findCurrentContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AuthContext context) {
            return Optional.of(context);
        }
        return Optional.empty();
    }

    public static AuthContext getCurrentContext() {
        return findCurrentContext()
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }

    public static UUID getCurrentUserId() {
        return getCurrentContext().userId();
    }
}
