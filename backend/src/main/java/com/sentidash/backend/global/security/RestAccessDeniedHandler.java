package com.sentidash.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * 권한 부족은 어떤 역할이 필요한지 알려주지 않고 FORBIDDEN 으로만 응답한다.
 */
@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private static final Logger log = LoggerFactory.getLogger(RestAccessDeniedHandler.class);

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        AuthContext context = SecurityUtils.findCurrentContext().orElse(null);
        log.warn("Access denied uri={} userId={} role={}", request.getRequestURI(),
                context != null ? context.userId() : null,
                context != null ? context.role() : null);
        problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, "FORBIDDEN", "FORBIDDEN");
    }
}
