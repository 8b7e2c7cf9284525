package com.sentidash.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.sentidash.backend.modules.auth.domain.IdentityProvider;
import com.sentidash.backend.modules.auth.domain.ProviderLink;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProviderLinkRepository extends JpaRepository<ProviderLink, UUID> {

    @Query("""
            select pl
              from ProviderLink pl
              join fetch pl.user
             where pl.provider = :provider
               and pl.externalSubjectId = :subject
            """)
    Optional<ProviderLink> findByProviderAndSubject(@Param("provider") IdentityProvider provider,
                                                    @Param("subject") String subject);

    @Query("select pl from ProviderLink pl where pl.user.id = :userId order by pl.linkedAt asc")
    List<ProviderLink> findByUserId(@Param("userId") UUID userId);

    boolean existsByUserIdAndProvider(UUID userId, IdentityProvider provider);
}
