package com.redisui.backend.audit.repo;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.redisui.backend.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByActionOrderByIdAsc(String action);
}
