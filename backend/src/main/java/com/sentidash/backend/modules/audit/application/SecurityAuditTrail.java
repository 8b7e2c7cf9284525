package com.sentidash.backend.modules.audit.application;

import java.util.Map;
import java.util.UUID;

import com.sentidash.backend.global.web.RequestIdFilter;
import com.sentidash.backend.modules.audit.application.AuditLogService.AuditLogCommand;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 인증/세션 보안 이벤트 기록. 기록 실패는 경고 로그만 남기고 호출자에게 전파하지 않는다.
 */
@Component
public class SecurityAuditTrail {

    private static final Logger log = LoggerFactory.getLogger(SecurityAuditTrail.class);

    public static final String RESOURCE_USER = "USER";
    public static final String RESOURCE_SESSION = "SESSION";

    private final AuditLogService auditLogService;

    public SecurityAuditTrail(AuditLogService auditLogService) {
        this.auditLogService = auditLogService;
    }

    public void userEvent(String actionType, UUID userId, UUID actorUserId, Map<String, Object> detail) {
        record(actionType, RESOURCE_USER, String.valueOf(userId), actorUserId, detail);
    }

    public void sessionEvent(String actionType, UUID sessionId, UUID actorUserId, Map<String, Object> detail) {
        record(actionType, RESOURCE_SESSION, String.valueOf(sessionId), actorUserId, detail);
    }

    private void record(String actionType, String resourceType, String resourceKey, UUID actorUserId,
                        Map<String, Object> detail) {
        try {
            auditLogService.record(new AuditLogCommand(
                    actionType,
                    resourceType,
                    resourceKey,
                    actorUserId,
                    RequestIdFilter.currentRequestId(),
                    detail
            ));
        } catch (RuntimeException ex) {
            log.warn("Audit record failed action={} resource={}:{}", actionType, resourceType, resourceKey, ex);
        }
    }
}
