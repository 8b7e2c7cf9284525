package com.sentidash.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정 검증.
 * 서명 키나 audience 가 비어 있으면 토큰 경계가 무의미해지므로 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_SECRET = "dev-jwt-secret-key-change-in-production-2025";
    private static final int MIN_SECRET_LENGTH = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "auth.jwt.issuer",
            "auth.jwt.audience",
            "auth.magic-link.link-base-url"
        };

        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (jwtSecret.filter(DEFAULT_SECRET::equals).isPresent()) {
            invalidVars.add("jwt.secret: 기본값을 실제 랜덤 문자열로 변경하세요");
        } else if (jwtSecret.filter(secret -> !secret.isBlank() && secret.length() < MIN_SECRET_LENGTH).isPresent()) {
            invalidVars.add("jwt.secret: 최소 " + MIN_SECRET_LENGTH + "자 이상이어야 합니다");
        }

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < 60000 || expiration > 3600000) { // 1분~1시간 (밀리초)
                    invalidVars.add("jwt.expiration: 60000-3600000 밀리초 범위여야 합니다");
                }
            } catch (NumberFormatException e) {
                invalidVars.add("jwt.expiration: 숫자여야 합니다");
            }
        }

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required configuration: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(v -> log.error("Invalid configuration: {}", v));
            throw new IllegalStateException("Environment validation failed: missing=" + missingVars
                    + ", invalid=" + invalidVars.size());
        }

        log.info("Environment validation passed");
    }
}
