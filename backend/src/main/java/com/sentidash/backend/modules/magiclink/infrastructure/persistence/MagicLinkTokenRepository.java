package com.sentidash.backend.modules.magiclink.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.sentidash.backend.modules.magiclink.domain.MagicLinkToken;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface MagicLinkTokenRepository extends JpaRepository<MagicLinkToken, String> {

    long countByEmailAndCreatedAtAfter(String email, OffsetDateTime since);

    long countBySourceAddressAndCreatedAtAfter(String sourceAddress, OffsetDateTime since);

    Optional<MagicLinkToken> findFirstByEmailAndCreatedAtAfterOrderByCreatedAtAsc(String email, OffsetDateTime since);

    Optional<MagicLinkToken> findFirstBySourceAddressAndCreatedAtAfterOrderByCreatedAtAsc(String sourceAddress, OffsetDateTime since);

    /**
     * 미사용이고 만료되지 않은 토큰만 사용 처리한다. 동시 요청 중 정확히 하나만 1 을 받는다.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update MagicLinkToken t
               set t.used = true,
                   t.usedAt = :now,
                   t.usedByAddress = :address
             where t.tokenHash = :tokenHash
               and t.used = false
               and t.expiresAt > :now
            """)
    int consume(@Param("tokenHash") String tokenHash,
                @Param("now") OffsetDateTime now,
                @Param("address") String address);
}
