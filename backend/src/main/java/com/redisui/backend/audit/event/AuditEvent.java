package com.redisui.backend.audit.event;

import java.time.LocalDateTime;
import java.util.Map;

import com.redisui.backend.audit.domain.AuditAction;
import com.redisui.backend.global.web.ClientInfo;

/**
 * 감사 로그 한 건 (actor, action, resource, ip, user-agent, 시각)
 * - 발행만 하고 결과는 기다리지 않는다 (AuditLogListener가 비동기로 저장)
 */
public record AuditEvent(
        Long userId,
        AuditAction action,
        String resourceType,
        String resourceId,
        String resourceName,
        Map<String, Object> details,
        ClientInfo client,
        LocalDateTime occurredAt
) {}
