package com.redisui.backend.audit.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.redisui.backend.audit.domain.AuditAction;
import com.redisui.backend.audit.event.AuditEvent;
import com.redisui.backend.global.web.ClientInfo;

import lombok.RequiredArgsConstructor;

/**
 * 감사 로그 발행기 (fire-and-forget)
 * - 저장은 AuditLogListener 가 비동기로 처리
 * - 저장 실패가 로그인/로그아웃 흐름을 막으면 안 된다
 */
@Service
@RequiredArgsConstructor
public class AuditLogger {

    public static final String RESOURCE_SESSION = "session";
    public static final String RESOURCE_USER = "user";

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public void log(Long userId, AuditAction action, String resourceType, String resourceId,
                    String resourceName, Map<String, Object> details, ClientInfo client) {
        publisher.publishEvent(new AuditEvent(
                userId,
                action,
                resourceType,
                resourceId,
                resourceName,
                details,
                client == null ? ClientInfo.unknown() : client,
                LocalDateTime.now(clock)));
    }
}
