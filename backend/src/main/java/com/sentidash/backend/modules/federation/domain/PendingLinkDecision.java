package com.sentidash.backend.modules.federation.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sentidash.backend.modules.auth.domain.IdentityProvider;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * 자동 연결할 수 없는 OAuth 계정에 대해 사용자의 선택을 기다리는 요청. 한 번만 해소된다.
 */
@Entity
@Table(name = "pending_link_decision")
public class PendingLinkDecision {

    @Id
    @Column(name = "decision_id", nullable = false, updatable = false, length = 64)
    private String decisionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, length = 20)
    private IdentityProvider provider;

    @Column(name = "subject", nullable = false, length = 320)
    private String subject;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Column(name = "candidate_user_id", nullable = false, columnDefinition = "uuid")
    private UUID candidateUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution", length = 20)
    private LinkChoice resolution;

    protected PendingLinkDecision() {
    }

    public PendingLinkDecision(String decisionId, IdentityProvider provider, String subject, String email,
                               boolean emailVerified, UUID candidateUserId,
                               OffsetDateTime createdAt, OffsetDateTime expiresAt) {
        this.decisionId = decisionId;
        this.provider = provider;
        this.subject = subject;
        this.email = email;
        this.emailVerified = emailVerified;
        this.candidateUserId = candidateUserId;
        this.createdAt = createdAt;
        this.expiresAt = expiresAt;
    }

    public String getDecisionId() {
        return decisionId;
    }

    public IdentityProvider getProvider() {
        return provider;
    }

    public String getSubject() {
        return subject;
    }

    public String getEmail() {
        return email;
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public UUID getCandidateUserId() {
        return candidateUserId;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getResolvedAt() {
        return resolvedAt;
    }

    public LinkChoice getResolution() {
        return resolution;
    }

    public boolean isOpen(OffsetDateTime now) {
        return resolvedAt == null && expiresAt.isAfter(now);
    }
}
