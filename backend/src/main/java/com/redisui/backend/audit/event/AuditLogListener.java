package com.redisui.backend.audit.event;

import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.redisui.backend.audit.domain.AuditLog;
import com.redisui.backend.audit.repo.AuditLogRepository;
import com.redisui.backend.audit.support.AuditDetailsMasker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogListener {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    // 요청 스레드와 분리해서 저장. 저장 실패는 error 로그로 남긴다
    @Async
    @EventListener
    public void on(AuditEvent event) {
        try {
            String details = event.details() == null
                    ? null
                    : objectMapper.writeValueAsString(AuditDetailsMasker.mask(event.details()));

            auditLogRepository.save(AuditLog.of(
                    event.userId(),
                    event.action().code(),
                    event.resourceType(),
                    event.resourceId(),
                    event.resourceName(),
                    details,
                    event.client().ip(),
                    event.client().userAgent(),
                    event.occurredAt()));
        } catch (Exception e) {
            log.error("Failed to write audit log. action={}, userId={}", event.action().code(), event.userId(), e);
        }
    }
}
