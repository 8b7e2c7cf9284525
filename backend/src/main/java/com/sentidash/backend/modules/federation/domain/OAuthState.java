package com.sentidash.backend.modules.federation.domain;

import java.time.OffsetDateTime;

import com.sentidash.backend.modules.auth.domain.IdentityProvider;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "oauth_state")
public class OAuthState {

    @Id
    @Column(name = "state_id", nullable = false, updatable = false, length = 64)
    private String stateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 20)
    private IdentityProvider provider;

    @Column(name = "redirect_uri", nullable = false, length = 512)
    private String redirectUri;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    protected OAuthState() {
    }

    public OAuthState(String stateId, IdentityProvider provider, String redirectUri,
                      OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.stateId = stateId;
        this.provider = provider;
        this.redirectUri = redirectUri;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getStateId() {
        return stateId;
    }

    public IdentityProvider getProvider() {
        return provider;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isUsed() {
        return used;
    }
}
