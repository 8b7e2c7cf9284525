package com.sentidash.backend.modules.federation.infrastructure.oauth;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.federation.application.OAuthIdentity;
import com.sentidash.backend.modules.federation.application.OAuthProviderClient;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * authorization code 교환(POST, 재시도 없음)과 사용자 정보 조회(GET, 멱등이므로 1회 재시도).
 */
@Component
public class HttpOAuthProviderClient implements OAuthProviderClient {

    private static final Logger log = LoggerFactory.getLogger(HttpOAuthProviderClient.class);

    static final long RETRY_BACKOFF_MILLIS = 200L;

    private final RestTemplate restTemplate;
    private final OAuthProviderProperties properties;

    public HttpOAuthProviderClient(RestTemplate externalRestTemplate, OAuthProviderProperties properties) {
        this.restTemplate = externalRestTemplate;
        this.properties = properties;
    }

    @Override
    public OAuthIdentity exchange(IdentityProvider provider, String code, String redirectUri) {
        OAuthProviderProperties.Provider settings = properties.getProviders().get(provider.getCode());
        if (settings == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_PROVIDER");
        }
        String accessToken = exchangeCode(provider, settings, code, redirectUri);
        JsonNode userInfo = getWithRetry(provider, settings.getUserInfoUri(), accessToken);
        return switch (provider) {
            case GOOGLE -> new OAuthIdentity(
                    text(userInfo, "sub"),
                    text(userInfo, "email"),
                    userInfo.path("email_verified").asBoolean(false)
            );
            case GITHUB -> githubIdentity(provider, settings, userInfo, accessToken);
            case EMAIL -> throw new ProblemException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_PROVIDER");
        };
    }

    private String exchangeCode(IdentityProvider provider, OAuthProviderProperties.Provider settings,
                                String code, String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        form.add("client_id", settings.getClientId());
        form.add("client_secret", settings.getClientSecret());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            JsonNode body = restTemplate.postForObject(settings.getTokenUri(), new HttpEntity<>(form, headers), JsonNode.class);
            String accessToken = body != null ? text(body, "access_token") : null;
            if (accessToken == null) {
                log.warn("OAuth token response without access_token provider={}", provider.getCode());
                throw new ProblemException(HttpStatus.BAD_REQUEST, "OAUTH_EXCHANGE_FAILED");
            }
            return accessToken;
        } catch (HttpClientErrorException ex) {
            log.warn("OAuth code rejected provider={} status={}", provider.getCode(), ex.getStatusCode());
            throw new ProblemException(HttpStatus.BAD_REQUEST, "OAUTH_EXCHANGE_FAILED", null, ex);
        } catch (RestClientException ex) {
            log.error("OAuth token endpoint unavailable provider={}", provider.getCode(), ex);
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "OAUTH_PROVIDER_UNAVAILABLE", null, ex);
        }
    }

    private OAuthIdentity githubIdentity(IdentityProvider provider, OAuthProviderProperties.Provider settings,
                                         JsonNode user, String accessToken) {
        String subject = user.path("id").isMissingNode() ? null : user.path("id").asText();
        String email = text(user, "email");
        boolean verified = false;
        if (settings.getEmailsUri() != null) {
            JsonNode emails = getWithRetry(provider, settings.getEmailsUri(), accessToken);
            for (JsonNode entry : emails) {
                if (entry.path("primary").asBoolean(false)) {
                    email = text(entry, "email");
                    verified = entry.path("verified").asBoolean(false);
                    break;
                }
            }
        }
        return new OAuthIdentity(subject, email, verified);
    }

    private JsonNode getWithRetry(IdentityProvider provider, String uri, String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<Void> request = new HttpEntity<>(headers);
        RestClientException lastFailure = null;
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                JsonNode body = restTemplate.exchange(uri, HttpMethod.GET, request, JsonNode.class).getBody();
                if (body == null) {
                    throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "OAUTH_PROVIDER_UNAVAILABLE");
                }
                return body;
            } catch (HttpClientErrorException ex) {
                log.warn("OAuth userinfo rejected provider={} status={}", provider.getCode(), ex.getStatusCode());
                throw new ProblemException(HttpStatus.BAD_REQUEST, "OAUTH_EXCHANGE_FAILED", null, ex);
            } catch (RestClientException ex) {
                lastFailure = ex;
                log.warn("OAuth userinfo attempt {} failed provider={}", attempt, provider.getCode());
                if (attempt == 1) {
                    sleepBackoff();
                }
            }
        }
        throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "OAUTH_PROVIDER_UNAVAILABLE", null, lastFailure);
    }

    private static void sleepBackoff() {
        try {
            Thread.sleep(RETRY_BACKOFF_MILLIS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProblemException(HttpStatus.SERVICE_UNAVAILABLE, "OAUTH_PROVIDER_UNAVAILABLE", null, ex);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
