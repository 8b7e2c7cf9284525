package com.sentidash.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.sentidash.backend.global.web.RequestIdFilter;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

class ProblemResponseTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("요청 범위의 requestId 를 응답에 싣는다")
    void carriesRequestIdFromMdc() {
        MDC.put(RequestIdFilter.REQUEST_ID_MDC_KEY, "req-123");

        ProblemResponse body = ProblemResponse.of(HttpStatus.CONFLICT, "MAGIC_LINK_ALREADY_USED", null, "/auth/verify");

        assertThat(body.requestId()).isEqualTo("req-123");
        assertThat(body.code()).isEqualTo("MAGIC_LINK_ALREADY_USED");
        assertThat(body.type()).endsWith("/magic_link_already_used");
        assertThat(body.detail()).isEqualTo("Conflict");
        assertThat(body.instance()).isEqualTo("/auth/verify");
    }

    @Test
    void missingCodeFallsBackToStatusName() {
        ProblemResponse body = ProblemResponse.of(HttpStatus.SERVICE_UNAVAILABLE, " ", "Temporarily unavailable", null);

        assertThat(body.code()).isEqualTo("SERVICE_UNAVAILABLE");
        assertThat(body.status()).isEqualTo(503);
        assertThat(body.requestId()).isNull();
    }
}
