package com.sentidash.backend.modules.federation.infrastructure.oauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServiceUnavailable;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.federation.application.OAuthIdentity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class HttpOAuthProviderClientTest {

    private MockRestServiceServer server;
    private HttpOAuthProviderClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        OAuthProviderProperties properties = new OAuthProviderProperties();
        properties.getProviders().put("google", provider("https://google.test/token", "https://google.test/userinfo", null));
        properties.getProviders().put("github",
                provider("https://github.test/token", "https://api.github.test/user", "https://api.github.test/user/emails"));
        client = new HttpOAuthProviderClient(restTemplate, properties);
    }

    @Test
    void googleIdentityComesFromUserInfo() {
        expectToken("https://google.test/token");
        server.expect(requestTo("https://google.test/userinfo"))
                .andExpect(header("Authorization", "Bearer at-1"))
                .andRespond(withSuccess("""
                        {"sub":"g-123","email":"Person@Gmail.com","email_verified":true}
                        """, MediaType.APPLICATION_JSON));

        OAuthIdentity identity = client.exchange(IdentityProvider.GOOGLE, "code-1", "https://app/cb");

        assertThat(identity.subject()).isEqualTo("g-123");
        assertThat(identity.email()).isEqualTo("Person@Gmail.com");
        assertThat(identity.emailVerified()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("GitHub 는 primary 이메일과 그 검증 여부를 쓴다")
    void githubUsesPrimaryEmail() {
        expectToken("https://github.test/token");
        server.expect(requestTo("https://api.github.test/user"))
                .andRespond(withSuccess("{\"id\":4242,\"email\":null}", MediaType.APPLICATION_JSON));
        server.expect(requestTo("https://api.github.test/user/emails"))
                .andRespond(withSuccess("""
                        [{"email":"old@example.com","primary":false,"verified":true},
                         {"email":"main@example.com","primary":true,"verified":true}]
                        """, MediaType.APPLICATION_JSON));

        OAuthIdentity identity = client.exchange(IdentityProvider.GITHUB, "code-2", "https://app/cb");

        assertThat(identity.subject()).isEqualTo("4242");
        assertThat(identity.email()).isEqualTo("main@example.com");
        assertThat(identity.emailVerified()).isTrue();
        server.verify();
    }

    @Test
    void userInfoIsRetriedOnceAfterServerError() {
        expectToken("https://google.test/token");
        server.expect(requestTo("https://google.test/userinfo")).andRespond(withServiceUnavailable());
        server.expect(requestTo("https://google.test/userinfo"))
                .andRespond(withSuccess("{\"sub\":\"g-1\",\"email\":\"a@gmail.com\",\"email_verified\":true}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.exchange(IdentityProvider.GOOGLE, "code", "https://app/cb").subject()).isEqualTo("g-1");
        server.verify();
    }

    @Test
    void secondServerErrorIsProviderUnavailable() {
        expectToken("https://google.test/token");
        server.expect(requestTo("https://google.test/userinfo")).andRespond(withServiceUnavailable());
        server.expect(requestTo("https://google.test/userinfo")).andRespond(withServiceUnavailable());

        assertThatThrownBy(() -> client.exchange(IdentityProvider.GOOGLE, "code", "https://app/cb"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("OAUTH_PROVIDER_UNAVAILABLE"));
    }

    @Test
    void rejectedCodeIsExchangeFailure() {
        server.expect(requestTo("https://google.test/token"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\":\"invalid_grant\"}"));

        assertThatThrownBy(() -> client.exchange(IdentityProvider.GOOGLE, "used-code", "https://app/cb"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("OAUTH_EXCHANGE_FAILED");
                    assertThat(ex.getHttpStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                });
    }

    private void expectToken(String tokenUri) {
        server.expect(requestTo(tokenUri))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
                .andRespond(withSuccess("{\"access_token\":\"at-1\",\"token_type\":\"bearer\"}",
                        MediaType.APPLICATION_JSON));
    }

    private static OAuthProviderProperties.Provider provider(String tokenUri, String userInfoUri, String emailsUri) {
        OAuthProviderProperties.Provider provider = new OAuthProviderProperties.Provider();
        provider.setClientId("client");
        provider.setClientSecret("secret");
        provider.setTokenUri(tokenUri);
        provider.setUserInfoUri(userInfoUri);
        provider.setEmailsUri(emailsUri);
        return provider;
    }
}
