package com.redisui.backend.auth.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @ConfigurationProperties(prefix = "app.auth"):
 * application.yml 의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.
 * 잘못된 값이면 부팅 단계에서 바로 실패한다(@Validated).
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @Valid @NotNull Session session,
        @Valid @NotNull Cookie cookie,
        @Valid @NotNull BruteForce bruteForce,
        @Valid @NotNull Password password,
        @Valid @NotNull Gateway gateway
) {

    /**
     * Access Token(JWT) 관련 설정 (referenced by JwtService)
     * - issuer: 토큰 발급자 식별자 (redis-ui)
     * - accessTtlSeconds: Access Token 수명(초 단위, 기본 15분)
     * - secret: HS256 서명을 위한 비밀키 문자열 (32바이트 이상)
     */
    public record Jwt(
            @NotBlank String issuer,
            @Min(1) long accessTtlSeconds,
            @NotBlank @Size(min = 32) String secret
    ) {}

    /**
     * 서버 측 세션(auth_sessions) 수명
     * - sessionTtlSeconds: remember=false 일 때 (기본 1일)
     * - rememberMeSeconds: remember=true 일 때 (기본 30일)
     * - cleanupIntervalSeconds: 만료 세션 정리 주기
     */
    public record Session(
            @Min(1) long sessionTtlSeconds,
            @Min(1) long rememberMeSeconds,
            @Min(1) long cleanupIntervalSeconds
    ) {}

    /**
     * 인증 쿠키 공통 속성 (access/refresh 둘 다 동일하게 적용)
     * - secure: https 에서만 전송 (prod 프로필에서 true)
     * - sameSite: Strict 고정 권장
     * - path: "/" (페이지 라우트와 /api 모두에서 읽어야 하므로)
     */
    public record Cookie(
            boolean secure,
            @NotBlank @Pattern(regexp = "Strict|Lax|None") String sameSite,
            @NotBlank String path
    ) {}

    /**
     * 로그인 무차별 대입 방어 정책 (referenced by LoginAttemptGuard)
     * - maxAttempts: 윈도우 안에서 허용되는 실패 횟수 (N번째 실패에서 잠금)
     * - lockoutSeconds: 잠금 유지 시간
     * - windowSeconds: 실패 카운트를 누적하는 구간
     */
    public record BruteForce(
            @Min(1) int maxAttempts,
            @Min(1) long lockoutSeconds,
            @Min(1) long windowSeconds,
            @Min(1) long cleanupIntervalSeconds
    ) {}

    /** 비밀번호 복잡도 정책 (referenced by PasswordPolicy) */
    public record Password(
            @Min(1) int minLength,
            boolean requireUppercase,
            boolean requireLowercase,
            boolean requireNumber,
            boolean requireSpecial
    ) {}

    /**
     * 페이지 라우트 게이트웨이 설정 (referenced by AuthGatewayFilter)
     * - publicPrefixes: 게이트웨이가 손대지 않는 경로 (API는 자체적으로 인증 처리)
     * - protectedRoutes: 로그인이 필요한 페이지. "/"는 정확히 일치할 때만 해당
     * - authRoutes: 로그인 상태면 들어갈 필요가 없는 페이지 (로그인 페이지)
     */
    public record Gateway(
            @NotNull List<String> publicPrefixes,
            @NotEmpty List<String> protectedRoutes,
            @NotEmpty List<String> authRoutes,
            @NotBlank String loginPath,
            @NotBlank String homePath
    ) {}
}
