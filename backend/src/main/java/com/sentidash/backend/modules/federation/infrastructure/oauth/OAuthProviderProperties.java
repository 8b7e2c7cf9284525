package com.sentidash.backend.modules.federation.infrastructure.oauth;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * auth.oauth.providers.&lt;google|github&gt;.* 공급자별 엔드포인트와 클라이언트 자격 증명.
 */
@ConfigurationProperties(prefix = "auth.oauth")
public class OAuthProviderProperties {

    private Map<String, Provider> providers = new LinkedHashMap<>();

    private List<String> allowedRedirectUris = new ArrayList<>();

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public List<String> getAllowedRedirectUris() {
        return allowedRedirectUris;
    }

    public void setAllowedRedirectUris(List<String> allowedRedirectUris) {
        this.allowedRedirectUris = allowedRedirectUris;
    }

    public static class Provider {

        private String clientId;
        private String clientSecret;
        private String authorizeUri;
        private String tokenUri;
        private String userInfoUri;
        private String emailsUri;
        private String scope;

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getAuthorizeUri() {
            return authorizeUri;
        }

        public void setAuthorizeUri(String authorizeUri) {
            this.authorizeUri = authorizeUri;
        }

        public String getTokenUri() {
            return tokenUri;
        }

        public void setTokenUri(String tokenUri) {
            this.tokenUri = tokenUri;
        }

        public String getUserInfoUri() {
            return userInfoUri;
        }

        public void setUserInfoUri(String userInfoUri) {
            this.userInfoUri = userInfoUri;
        }

        public String getEmailsUri() {
            return emailsUri;
        }

        public void setEmailsUri(String emailsUri) {
            this.emailsUri = emailsUri;
        }

        public String getScope() {
            return scope;
        }

        public void setScope(String scope) {
            this.scope = scope;
        }
    }
}
