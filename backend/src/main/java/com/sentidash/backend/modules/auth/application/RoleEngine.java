package com.sentidash.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.sentidash.backend.global.error.ProblemException;
import com.sentidash.backend.modules.audit.application.SecurityAuditTrail;
import com.sentidash.backend.modules.auth.domain.AppUser;
import com.sentidash.backend.modules.auth.domain.UserRole;
import com.sentidash.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * 역할 상태 기계. 모든 전이는 "현재 역할이 더 낮을 때만" 조건부 갱신으로 수행되어 역할이 내려가지 않는다.
 */
@Service
public class RoleEngine {

    private static final Logger log = LoggerFactory.getLogger(RoleEngine.class);

    private final AppUserRepository appUserRepository;
    private final SecurityAuditTrail auditTrail;
    private final Clock clock;

    public RoleEngine(AppUserRepository appUserRepository, SecurityAuditTrail auditTrail, Clock clock) {
        this.appUserRepository = appUserRepository;
        this.auditTrail = auditTrail;
        this.clock = clock;
    }

    /**
     * 첫 인증(매직 링크, OAuth) 이후 ANONYMOUS → FREE. 이미 FREE 이상이면 아무것도 하지 않는다.
     * 실패는 로그만 남긴다. 인증 자체는 이미 커밋된 상태이기 때문이다.
     *
     * @return 이번 호출로 역할이 바뀌었으면 true
     */
    public boolean advance(UUID userId, String assignedBy) {
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            int updated = appUserRepository.updateRoleIfIn(userId, List.of(UserRole.ANONYMOUS), UserRole.FREE, now, assignedBy);
            if (updated == 1) {
                log.info("Role advanced userId={} role={} assignedBy={}", userId, UserRole.FREE, assignedBy);
                auditTrail.userEvent("ROLE_ADVANCED", userId, userId,
                        Map.of("from", UserRole.ANONYMOUS.name(), "to", UserRole.FREE.name(), "assignedBy", assignedBy));
                return true;
            }
            return false;
        } catch (RuntimeException ex) {
            log.warn("Role advancement failed userId={} assignedBy={}", userId, assignedBy, ex);
            return false;
        }
    }

    /**
     * 결제/운영자 경로의 역할 부여. 더 낮은 역할에서만 올라가며 같거나 낮은 목표는 no-op.
     */
    public RoleAssignment assignRole(UUID userId, UserRole target, String assignedBy) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
        List<UserRole> fromRoles = target.lowerRoles();
        if (fromRoles.isEmpty() || !target.isHigherThan(user.getRole())) {
            return new RoleAssignment(userId, user.getRole(), false);
        }
        int updated = appUserRepository.updateRoleIfIn(userId, fromRoles, target, OffsetDateTime.now(clock), assignedBy);
        if (updated == 0) {
            // 동시에 더 높은 역할이 부여된 경우
            UserRole current = appUserRepository.findById(userId).map(AppUser::getRole).orElse(user.getRole());
            return new RoleAssignment(userId, current, false);
        }
        log.info("Role assigned userId={} from={} to={} assignedBy={}", userId, user.getRole(), target, assignedBy);
        auditTrail.userEvent("ROLE_ASSIGNED", userId, null,
                Map.of("from", user.getRole().name(), "to", target.name(), "assignedBy", assignedBy));
        return new RoleAssignment(userId, target, true);
    }

    public record RoleAssignment(UUID userId, UserRole role, boolean changed) {
    }
}
