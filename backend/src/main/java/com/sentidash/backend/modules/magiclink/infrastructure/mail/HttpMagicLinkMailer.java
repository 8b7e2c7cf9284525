package com.sentidash.backend.modules.magiclink.infrastructure.mail;

import java.time.OffsetDateTime;
import java.util.Map;

import com.sentidash.backend.modules.magiclink.application.MagicLinkDeliveryException;
import com.sentidash.backend.modules.magiclink.application.MagicLinkMailer;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 외부 메일 발송 API 로 링크를 전달한다. 타임아웃은 RestTemplate 설정을 따른다.
 */
public class HttpMagicLinkMailer implements MagicLinkMailer {

    static final String SUBJECT = "Your Sentidash sign-in link";

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String apiKey;

    public HttpMagicLinkMailer(RestTemplate restTemplate, String endpoint, String apiKey) {
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public void send(String email, String link, OffsetDateTime expiresAt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }
        Map<String, Object> body = Map.of(
                "to", email,
                "subject", SUBJECT,
                "link", link,
                "expiresAt", expiresAt.toString()
        );
        try {
            restTemplate.postForEntity(endpoint, new HttpEntity<>(body, headers), Void.class);
        } catch (RestClientException ex) {
            throw new MagicLinkDeliveryException("Mailer request failed", ex);
        }
    }
}
