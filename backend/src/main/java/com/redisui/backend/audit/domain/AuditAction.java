package com.redisui.backend.audit.domain;

/**
 * 인증 코어가 남기는 감사 이벤트 종류
 * - code는 audit_logs.action 컬럼 값 그대로
 */
public enum AuditAction {

    LOGIN("auth.login"),
    LOGIN_FAILED("auth.login_failed"),
    LOGIN_BLOCKED("auth.login_blocked"),
    LOGOUT("auth.logout"),
    REFRESH("auth.refresh"),
    USER_CREATED("user.created");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
