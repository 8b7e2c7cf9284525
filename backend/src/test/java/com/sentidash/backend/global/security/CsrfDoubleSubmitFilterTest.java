package com.sentidash.backend.global.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class CsrfDoubleSubmitFilterTest {

    private CsrfDoubleSubmitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new CsrfDoubleSubmitFilter(new ProblemResponseWriter(new ObjectMapper()));
    }

    @Test
    @DisplayName("쿠키 인증 상태 변경 요청에 CSRF 헤더가 없으면 403")
    void cookieRequestWithoutHeaderIsRejected() throws Exception {
        MockHttpServletRequest request = post("/auth/signout");
        request.setCookies(new Cookie(AuthCookies.REFRESH_COOKIE, "rt"), new Cookie(AuthCookies.CSRF_COOKIE, "c-1"));
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(response.getContentAsString()).contains("CSRF_TOKEN_INVALID");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void mismatchedHeaderIsRejected() throws Exception {
        MockHttpServletRequest request = post("/auth/signout");
        request.setCookies(new Cookie(AuthCookies.REFRESH_COOKIE, "rt"), new Cookie(AuthCookies.CSRF_COOKIE, "c-1"));
        request.addHeader(AuthCookies.CSRF_HEADER, "c-2");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getStatus()).isEqualTo(403);
    }

    @Test
    void matchingHeaderPasses() throws Exception {
        MockHttpServletRequest request = post("/auth/signout");
        request.setCookies(new Cookie(AuthCookies.REFRESH_COOKIE, "rt"), new Cookie(AuthCookies.CSRF_COOKIE, "c-1"));
        request.addHeader(AuthCookies.CSRF_HEADER, "c-1");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    @DisplayName("Bearer 요청, 안전한 메서드, 면제 경로는 검사하지 않는다")
    void bearerSafeAndExemptRequestsPass() throws Exception {
        MockHttpServletRequest bearer = post("/auth/oauth/link-decision");
        bearer.setCookies(new Cookie(AuthCookies.REFRESH_COOKIE, "rt"));
        bearer.addHeader("Authorization", "Bearer abc");

        MockHttpServletRequest safe = new MockHttpServletRequest("GET", "/auth/session");
        safe.setServletPath("/auth/session");
        safe.setCookies(new Cookie(AuthCookies.REFRESH_COOKIE, "rt"));

        MockHttpServletRequest exempt = post("/auth/refresh");
        exempt.setCookies(new Cookie(AuthCookies.REFRESH_COOKIE, "rt"));

        for (MockHttpServletRequest request : new MockHttpServletRequest[] {bearer, safe, exempt}) {
            MockFilterChain chain = new MockFilterChain();
            filter.doFilter(request, new MockHttpServletResponse(), chain);
            assertThat(chain.getRequest()).as(request.getRequestURI()).isNotNull();
        }
    }

    @Test
    void requestWithoutSessionCookieIsNotChecked() throws Exception {
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(post("/auth/oauth/link-decision"), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    private MockHttpServletRequest post(String path) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", path);
        request.setServletPath(path);
        return request;
    }
}
