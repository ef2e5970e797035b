package com.redisui.backend.global;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * - 컨트롤러/서비스에서 발생한 예외를 가로채
 * - HTTP 상태 코드 + ApiError 포맷으로 통일된 응답을 반환
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 전용 핸들러
     * - retryAfterSeconds가 있으면 Retry-After 헤더도 같이 내려준다 (423 잠금)
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiError> handle(ApiException e) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(e.getStatus());
        if (e.getRetryAfterSeconds() != null) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        return builder.body(ApiError.of(
                e.getCode(),
                e.getMessage(),
                e.getRetryAfterSeconds(),
                e.getDetails()));
    }

    /**
     * @RequestBody + @Valid 검증 실패
     * - 클라이언트에는 상세 정보 노출 안 하고 서버 로그에만 필드/메시지 기록
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handle(MethodArgumentNotValidException e) {
        e.getBindingResult().getFieldErrors()
                .forEach(fe -> log.warn("Validation error: field={}, message={}",
                            fe.getField(),
                            fe.getDefaultMessage()));

        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handle(ConstraintViolationException e) {
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    // JSON 파싱 자체가 실패한 경우 (깨진 body, 타입 불일치)
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handle(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity
                .status(BAD_REQUEST)
                .body(ApiError.of(ErrorCode.VALIDATION_ERROR));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handle(NoResourceFoundException e) {
        return ResponseEntity
                .status(ErrorCode.NOT_FOUND.status())
                .body(ApiError.of(ErrorCode.NOT_FOUND));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handle(HttpRequestMethodNotSupportedException e) {
        return ResponseEntity
                .status(ErrorCode.METHOD_NOT_ALLOWED.status())
                .body(ApiError.of(ErrorCode.METHOD_NOT_ALLOWED));
    }

    /**
     * 저장소 장애: 로그만 남기고 상세 내용은 노출하지 않는다
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiError> handle(DataAccessException e) {
        log.error("Storage failure", e);
        return ResponseEntity
                .status(ErrorCode.STORAGE_FAILURE.status())
                .body(ApiError.of(ErrorCode.STORAGE_FAILURE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handle(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity
                .status(ErrorCode.INTERNAL_ERROR.status())
                .body(ApiError.of(ErrorCode.INTERNAL_ERROR));
    }
}
