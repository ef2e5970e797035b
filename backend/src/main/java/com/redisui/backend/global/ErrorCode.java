package com.redisui.backend.global;

import org.springframework.http.HttpStatus;

/**
 * 서비스 전역 에러 코드
 * - HTTP 상태 코드 + 기본 메시지를 한 곳에서 관리
 * - ApiException / SecurityErrorWriter 모두 이 enum을 기준으로 응답을 만든다
 */
public enum ErrorCode {

    // 로그인
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "아이디 또는 비밀번호가 올바르지 않습니다."),
    ACCOUNT_LOCKED(HttpStatus.LOCKED, "로그인 시도가 너무 많아 계정이 일시적으로 잠겼습니다."),
    ACCOUNT_DISABLED(HttpStatus.FORBIDDEN, "비활성화된 계정입니다."),

    // 토큰/세션
    AUTH_REQUIRED(HttpStatus.UNAUTHORIZED, "인증이 필요합니다."),
    ACCESS_INVALID(HttpStatus.UNAUTHORIZED, "유효하지 않은 access token 입니다."),
    SESSION_EXPIRED(HttpStatus.UNAUTHORIZED, "세션이 만료되었거나 종료되었습니다."),
    REFRESH_INVALID(HttpStatus.UNAUTHORIZED, "유효하지 않은 refresh token 입니다."),

    // 인가
    FORBIDDEN(HttpStatus.FORBIDDEN, "권한이 없습니다."),

    // 사용자 등록
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "요청 값이 올바르지 않습니다."),
    WEAK_PASSWORD(HttpStatus.BAD_REQUEST, "비밀번호가 보안 정책을 만족하지 않습니다."),
    INVALID_USERNAME(HttpStatus.BAD_REQUEST, "아이디는 3~50자의 영문/숫자/밑줄만 사용할 수 있습니다."),
    USERNAME_ALREADY_EXISTS(HttpStatus.CONFLICT, "이미 사용 중인 아이디입니다."),

    // 요청
    NOT_FOUND(HttpStatus.NOT_FOUND, "요청한 리소스를 찾을 수 없습니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "지원하지 않는 요청 방식입니다."),

    // 서버
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "일시적인 오류가 발생했습니다."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus status() {
        return status;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
