package com.sentidash.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 외부 협력자(메일 발송, OAuth 공급자) 호출용 RestTemplate.
 * 응답이 없으면 인증 흐름 전체가 묶이므로 연결/읽기 타임아웃을 짧게 둔다.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate externalRestTemplate(
            @Value("${auth.http.connect-timeout-ms:3000}") int connectTimeoutMillis,
            @Value("${auth.http.read-timeout-ms:5000}") int readTimeoutMillis
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMillis);
        factory.setReadTimeout(readTimeoutMillis);
        return new RestTemplate(factory);
    }
}
