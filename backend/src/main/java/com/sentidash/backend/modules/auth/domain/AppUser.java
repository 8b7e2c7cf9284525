package com.sentidash.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import com.sentidash.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role = UserRole.ANONYMOUS;

    @Column(name = "primary_email", length = 320)
    private String primaryEmail;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "verified_emails", nullable = false, columnDefinition = "jsonb")
    private List<String> verifiedEmails = new ArrayList<>();

    @Column(name = "pending_email", length = 320)
    private String pendingEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification", nullable = false, length = 20)
    private VerificationStatus verification = VerificationStatus.NONE;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_provider_used", length = 20)
    private IdentityProvider lastProviderUsed;

    @Column(name = "revocation_id", nullable = false)
    private long revocationId;

    @Column(name = "role_assigned_at")
    private OffsetDateTime roleAssignedAt;

    @Column(name = "role_assigned_by", length = 100)
    private String roleAssignedBy;

    @Column(name = "verification_marked_at")
    private OffsetDateTime verificationMarkedAt;

    @Column(name = "verification_marked_by", length = 100)
    private String verificationMarkedBy;

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public UUID getId() {
        return id;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public String getPrimaryEmail() {
        return primaryEmail;
    }

    public void setPrimaryEmail(String primaryEmail) {
        this.primaryEmail = normalizeEmail(primaryEmail);
    }

    public List<String> getVerifiedEmails() {
        return verifiedEmails;
    }

    public boolean hasVerifiedEmail(String email) {
        return verifiedEmails.contains(normalizeEmail(email));
    }

    public void addVerifiedEmail(String email) {
        String normalized = normalizeEmail(email);
        if (normalized != null && !verifiedEmails.contains(normalized)) {
            List<String> updated = new ArrayList<>(verifiedEmails);
            updated.add(normalized);
            this.verifiedEmails = updated;
        }
    }

    public String getPendingEmail() {
        return pendingEmail;
    }

    public void setPendingEmail(String pendingEmail) {
        this.pendingEmail = normalizeEmail(pendingEmail);
    }

    public VerificationStatus getVerification() {
        return verification;
    }

    public boolean isVerified() {
        return verification == VerificationStatus.VERIFIED;
    }

    /**
     * 인증 상태는 NONE → PENDING → VERIFIED 방향으로만 이동한다.
     */
    public void advanceVerification(VerificationStatus target, OffsetDateTime at, String markedBy) {
        if (target.compareTo(verification) <= 0) {
            return;
        }
        this.verification = target;
        this.verificationMarkedAt = at;
        this.verificationMarkedBy = markedBy;
    }

    public IdentityProvider getLastProviderUsed() {
        return lastProviderUsed;
    }

    public void setLastProviderUsed(IdentityProvider lastProviderUsed) {
        this.lastProviderUsed = lastProviderUsed;
    }

    public long getRevocationId() {
        return revocationId;
    }

    public OffsetDateTime getRoleAssignedAt() {
        return roleAssignedAt;
    }

    public String getRoleAssignedBy() {
        return roleAssignedBy;
    }

    public OffsetDateTime getVerificationMarkedAt() {
        return verificationMarkedAt;
    }

    public String getVerificationMarkedBy() {
        return verificationMarkedBy;
    }
}
