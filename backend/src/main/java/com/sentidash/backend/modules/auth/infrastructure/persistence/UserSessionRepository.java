package com.sentidash.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.sentidash.backend.modules.auth.domain.SessionRevocationReason;
import com.sentidash.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
             where us.user.id = :userId
               and us.revokedAt is null
               and us.refreshExpiresAt > :now
             order by us.issuedAt asc
            """)
    List<UserSession> findActiveSessions(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.id = :sessionId
               and us.revokedAt is null
            """)
    int revokeIfActive(@Param("sessionId") UUID sessionId,
                       @Param("revokedAt") OffsetDateTime revokedAt,
                       @Param("reason") SessionRevocationReason reason);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.revokedAt = :revokedAt,
                   us.revokedReason = :reason
             where us.user.id = :userId
               and us.revokedAt is null
            """)
    int revokeAllActive(@Param("userId") UUID userId,
                        @Param("revokedAt") OffsetDateTime revokedAt,
                        @Param("reason") SessionRevocationReason reason);

    /**
     * refresh token id 를 기대값에서 새 값으로 교체한다. 동시에 들어온 회전 요청 중 하나만 1 을 받는다.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserSession us
               set us.refreshTokenId = :newTokenId,
                   us.refreshTokenHash = :newTokenHash,
                   us.lastRotatedAt = :rotatedAt,
                   us.accessTokenExpiresAt = :accessExpiresAt,
                   us.refreshExpiresAt = :refreshExpiresAt,
                   us.updatedAt = :rotatedAt
             where us.id = :sessionId
               and us.refreshTokenId = :expectedTokenId
               and us.revokedAt is null
            """)
    int rotateRefreshToken(@Param("sessionId") UUID sessionId,
                           @Param("expectedTokenId") String expectedTokenId,
                           @Param("newTokenId") String newTokenId,
                           @Param("newTokenHash") String newTokenHash,
                           @Param("rotatedAt") OffsetDateTime rotatedAt,
                           @Param("accessExpiresAt") OffsetDateTime accessExpiresAt,
                           @Param("refreshExpiresAt") OffsetDateTime refreshExpiresAt);
}
