package com.sentidash.backend.global.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.sentidash.backend.global.web.RequestIdFilter;

import org.springframework.http.HttpStatus;

/**
 * 오류 응답 본문. requestId 는 같은 요청의 서버 로그를 찾는 데 쓰고, 요청 범위 밖에서 만들어지면 생략된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    private static final String ERROR_TYPE_BASE = "https://sentidash.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String slug = resolvedCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String resolvedDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                ERROR_TYPE_BASE + slug,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                resolvedDetail,
                instance,
                resolvedCode,
                RequestIdFilter.currentRequestId()
        );
    }
}
