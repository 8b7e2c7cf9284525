package com.sentidash.backend.modules.federation.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.federation.domain.OAuthState;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface OAuthStateRepository extends JpaRepository<OAuthState, String> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update OAuthState s
               set s.used = true
             where s.stateId = :stateId
               and s.provider = :provider
               and s.redirectUri = :redirectUri
               and s.used = false
               and s.expiresAt > :now
            """)
    int consume(@Param("stateId") String stateId,
                @Param("provider") IdentityProvider provider,
                @Param("redirectUri") String redirectUri,
                @Param("now") OffsetDateTime now);

    @Transactional
    @Modifying
    @Query("delete from OAuthState s where s.expiresAt <= :cutoff")
    int deleteExpired(@Param("cutoff") OffsetDateTime cutoff);
}
