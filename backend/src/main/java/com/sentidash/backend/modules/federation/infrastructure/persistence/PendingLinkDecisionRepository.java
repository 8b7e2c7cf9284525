package com.sentidash.backend.modules.federation.infrastructure.persistence;

import java.time.OffsetDateTime;

import com.sentidash.backend.modules.federation.domain.LinkChoice;
import com.sentidash.backend.modules.federation.domain.PendingLinkDecision;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface PendingLinkDecisionRepository extends JpaRepository<PendingLinkDecision, String> {

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update PendingLinkDecision d
               set d.resolvedAt = :now,
                   d.resolution = :choice
             where d.decisionId = :decisionId
               and d.resolvedAt is null
               and d.expiresAt > :now
            """)
    int resolve(@Param("decisionId") String decisionId,
                @Param("choice") LinkChoice choice,
                @Param("now") OffsetDateTime now);
}
