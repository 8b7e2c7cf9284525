package com.sentidash.backend.modules.federation.application;

import com.sentidash.backend.modules.auth.domain.IdentityProvider;

public interface OAuthProviderClient {

    /**
     * authorization code 를 교환해 신원을 조회한다.
     * 공급자 장애/타임아웃은 503 OAUTH_PROVIDER_UNAVAILABLE, 거절된 code 는 400 OAUTH_EXCHANGE_FAILED.
     */
    OAuthIdentity exchange(IdentityProvider provider, String code, String redirectUri);
}
