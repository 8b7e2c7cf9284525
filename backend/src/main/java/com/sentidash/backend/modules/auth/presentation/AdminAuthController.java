package com.sentidash.backend.modules.auth.presentation;

import java.util.UUID;

import com.sentidash.backend.global.security.SecurityUtils;
import com.sentidash.backend.modules.auth.application.RoleEngine;
import com.sentidash.backend.modules.auth.application.RoleEngine.RoleAssignment;
import com.sentidash.backend.modules.auth.application.SessionManager;
import com.sentidash.backend.modules.auth.domain.SessionRevocationReason;
import com.sentidash.backend.modules.auth.presentation.dto.AdminRevokeRequest;
import com.sentidash.backend.modules.auth.presentation.dto.AdminRevokeResponse;
import com.sentidash.backend.modules.auth.presentation.dto.RoleAssignmentRequest;
import com.sentidash.backend.modules.auth.presentation.dto.RoleAssignmentResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 운영자 전용. 접근 제어는 SecurityConfig 의 /admin/** 규칙이 담당한다.
 */
@RestController
public class AdminAuthController {

    private final SessionManager sessionManager;
    private final RoleEngine roleEngine;

    public AdminAuthController(SessionManager sessionManager, RoleEngine roleEngine) {
        this.sessionManager = sessionManager;
        this.roleEngine = roleEngine;
    }

    @Operation(summary = "세션 강제 폐기", description = "sessionId 하나 또는 userId 의 모든 세션을 폐기한다. 전체 폐기는 revocationId 를 올린다.")
    @PostMapping("/admin/sessions/revoke")
    public ResponseEntity<AdminRevokeResponse> revoke(@Valid @RequestBody AdminRevokeRequest request) {
        if (request.sessionId() != null) {
            boolean revoked = sessionManager.revoke(request.sessionId(), SessionRevocationReason.ADMIN_REVOKED);
            return ResponseEntity.ok(new AdminRevokeResponse(revoked ? 1 : 0));
        }
        int revoked = sessionManager.revokeAllForUser(request.userId(), SessionRevocationReason.USER_REVOKED_ALL);
        return ResponseEntity.ok(new AdminRevokeResponse(revoked));
    }

    @Operation(summary = "역할 부여", description = "더 높은 역할로만 이동한다. 같거나 낮은 역할 요청은 변경 없이 현재 역할을 돌려준다.")
    @PostMapping("/admin/users/{userId}/role")
    public ResponseEntity<RoleAssignmentResponse> assignRole(
            @PathVariable UUID userId,
            @Valid @RequestBody RoleAssignmentRequest request
    ) {
        String assignedBy = "admin:" + SecurityUtils.getCurrentUserId();
        RoleAssignment assignment = roleEngine.assignRole(userId, request.role(), assignedBy);
        return ResponseEntity.ok(new RoleAssignmentResponse(assignment.userId(), assignment.role().name(), assignment.changed()));
    }
}
