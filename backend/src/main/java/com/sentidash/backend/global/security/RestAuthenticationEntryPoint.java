package com.sentidash.backend.global.security;

import java.io.IOException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAuthenticationEntryPoint(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        if (authException instanceof TokenAuthenticationException tokenException) {
            problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED,
                    tokenException.getCode(), tokenException.getMessage());
            return;
        }
        problemResponseWriter.write(request, response, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required");
    }
}
