package com.sentidash.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.sentidash.backend.modules.audit.domain.AuditLog;
import com.sentidash.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    private final AuditLogRepository auditLogRepository;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.clock = clock;
    }

    /**
     * 호출자 트랜잭션과 분리해 기록한다. 감사 로그 실패가 인증 결과를 되돌리지 않도록 하기 위함.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setRequestId(command.requestId());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            String requestId,
            Map<String, Object> detail
    ) {
    }
}
