package com.sentidash.backend.modules.federation.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.auth.application.TokenCodec;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.federation.domain.OAuthState;
import com.sentidash.backend.modules.federation.infrastructure.oauth.OAuthProviderProperties;
import com.sentidash.backend.modules.federation.infrastructure.persistence.OAuthStateRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * OAuth authorize 요청의 state 값. 5분 안에 한 번만, 발급 당시의 공급자와 redirect URI 로만 쓸 수 있다.
 * 어떤 이유로 거절되든 응답은 INVALID_OAUTH_STATE 하나다.
 */
@Service
public class OAuthStateService {

    private static final Logger log = LoggerFactory.getLogger(OAuthStateService.class);

    static final Duration STATE_TTL = Duration.ofMinutes(5);
    private static final int STATE_BITS = 256;

    private final OAuthStateRepository oAuthStateRepository;
    private final OAuthProviderProperties properties;
    private final Clock clock;

    public OAuthStateService(OAuthStateRepository oAuthStateRepository, OAuthProviderProperties properties, Clock clock) {
        this.oAuthStateRepository = oAuthStateRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 설정된 공급자마다 state 를 새로 발급해 authorize URL 을 만든다.
     */
    public Map<String, String> authorizationUrls(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()
                || (!properties.getAllowedRedirectUris().isEmpty() && !properties.getAllowedRedirectUris().contains(redirectUri))) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_REDIRECT_URI");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        purgeExpired(now);

        Map<String, String> urls = new LinkedHashMap<>();
        properties.getProviders().forEach((code, settings) -> {
            IdentityProvider provider = IdentityProvider.fromOAuthCode(code);
            String state = TokenCodec.newRandomToken(STATE_BITS);
            oAuthStateRepository.save(new OAuthState(state, provider, redirectUri, now, now.plus(STATE_TTL)));
            UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(settings.getAuthorizeUri())
                    .queryParam("client_id", settings.getClientId())
                    .queryParam("redirect_uri", redirectUri)
                    .queryParam("response_type", "code")
                    .queryParam("state", state);
            if (settings.getScope() != null) {
                builder.queryParam("scope", settings.getScope());
            }
            urls.put(code, builder.encode().build().toUriString());
        });
        return urls;
    }

    public void consume(String state, IdentityProvider provider, String redirectUri) {
        if (state == null || state.isBlank() || redirectUri == null) {
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_OAUTH_STATE");
        }
        int updated = oAuthStateRepository.consume(state, provider, redirectUri, OffsetDateTime.now(clock));
        if (updated == 0) {
            log.warn("OAuth state rejected provider={}", provider.getCode());
            throw new ProblemException(HttpStatus.BAD_REQUEST, "INVALID_OAUTH_STATE");
        }
    }

    private void purgeExpired(OffsetDateTime now) {
        try {
            oAuthStateRepository.deleteExpired(now.minus(STATE_TTL));
        } catch (RuntimeException ex) {
            log.warn("Expired OAuth state purge failed", ex);
        }
    }
}
