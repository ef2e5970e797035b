package com.redisui.backend.global;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 에러 응답 DTO
 * - 모든 에러 응답을 동일한 포맷으로 내려주기 위함
 * - retryAfterSeconds/details는 필요한 경우에만 포함 (NON_NULL)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
        String code, // 에러 식별 코드 (ErrorCode.name())
        String message, // 사용자에게 보여줄 에러 메세지
        Integer retryAfterSeconds, // 잠금 해제까지 남은 시간(초)
        Object details) {

    public static ApiError of(String code, String message) {
        return new ApiError(code, message, null, null);
    }

    public static ApiError of(String code, String message, Integer retryAfterSeconds) {
        return new ApiError(code, message, retryAfterSeconds, null);
    }

    public static ApiError of(String code, String message, Integer retryAfterSeconds, Object details) {
        return new ApiError(code, message, retryAfterSeconds, details);
    }

    public static ApiError of(ErrorCode errorCode) {
        return of(errorCode.name(), errorCode.defaultMessage());
    }
}
