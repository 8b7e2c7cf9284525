package com.sentidash.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    // lower(primary_email) 유니크 인덱스를 타도록 식을 맞춘다
    @Query("select u from AppUser u where u.primaryEmail is not null and lower(u.primaryEmail) = lower(:email)")
    Optional<AppUser> findByPrimaryEmailIgnoreCase(@Param("email") String primaryEmail);

    @Query("select u.revocationId from AppUser u where u.id = :userId")
    Optional<Long> findRevocationId(@Param("userId") UUID userId);

    /**
     * 현재 역할이 {@code fromRoles} 중 하나일 때만 target 으로 바꾼다. 반환값 1 이 조건부 갱신의 승자다.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AppUser u
               set u.role = :target,
                   u.roleAssignedAt = :assignedAt,
                   u.roleAssignedBy = :assignedBy,
                   u.updatedAt = :assignedAt
             where u.id = :userId
               and u.role in :fromRoles
            """)
    int updateRoleIfIn(@Param("userId") UUID userId,
                       @Param("fromRoles") Collection<UserRole> fromRoles,
                       @Param("target") UserRole target,
                       @Param("assignedAt") OffsetDateTime assignedAt,
                       @Param("assignedBy") String assignedBy);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update AppUser u
               set u.revocationId = u.revocationId + 1,
                   u.updatedAt = :now
             where u.id = :userId
            """)
    int incrementRevocationId(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
