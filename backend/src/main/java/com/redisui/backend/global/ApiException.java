package com.redisui.backend.global;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * 비즈니스 로직에서 사용하는 커스텀 예외
 * - 컨트롤러/서비스 어디서든 HTTP 상태 코드 + 에러 코드 + 메시지를 함께 전달
 * - GlobalExceptionHandler에서 이 예외 하나로 공통 처리
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;
    private final String code;
    private final Integer retryAfterSeconds; // 423 잠금일 때만 사용
    private final Object details; // 비밀번호 정책 위반 목록 등

    public ApiException(ErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), null, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride) {
        this(errorCode, messageOverride, null, null);
    }

    public ApiException(ErrorCode errorCode, Integer retryAfterSeconds) {
        this(errorCode, errorCode.defaultMessage(), retryAfterSeconds, null);
    }

    public ApiException(ErrorCode errorCode, String messageOverride, Integer retryAfterSeconds, Object details) {
        super(messageOverride);
        this.errorCode = errorCode;
        this.status = errorCode.status();
        this.code = errorCode.name();
        this.retryAfterSeconds = retryAfterSeconds;
        this.details = details;
    }
}
