package com.sentidash.backend.modules.magiclink.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 매직 링크 토큰. 원문은 저장하지 않고 SHA-256 해시를 키로 쓴다. used 는 false → true 로 한 번만 바뀐다.
 */
@Entity
@Table(name = "magic_link_token")
public class MagicLinkToken {

    @Id
    @Column(name = "token_hash", nullable = false, updatable = false, length = 64)
    private String tokenHash;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    @Column(name = "source_address", length = 64)
    private String sourceAddress;

    @Column(name = "anonymous_user_id", columnDefinition = "uuid")
    private UUID anonymousUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    @Column(name = "used_at")
    private OffsetDateTime usedAt;

    @Column(name = "used_by_address", length = 64)
    private String usedByAddress;

    protected MagicLinkToken() {
    }

    public MagicLinkToken(String tokenHash, String email, String sourceAddress, UUID anonymousUserId,
                          OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.tokenHash = tokenHash;
        this.email = email;
        this.sourceAddress = sourceAddress;
        this.anonymousUserId = anonymousUserId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getTokenHash() {
        return tokenHash;
    }

    public String getEmail() {
        return email;
    }

    public String getSourceAddress() {
        return sourceAddress;
    }

    public UUID getAnonymousUserId() {
        return anonymousUserId;
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

    public OffsetDateTime getUsedAt() {
        return usedAt;
    }

    public String getUsedByAddress() {
        return usedByAddress;
    }

    public boolean isExpired(OffsetDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
