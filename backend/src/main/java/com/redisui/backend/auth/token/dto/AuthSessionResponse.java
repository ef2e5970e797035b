package com.redisui.backend.auth.token.dto;

import java.time.Instant;

import com.redisui.backend.auth.domain.UserRole;

/**
 * 로그인 / 리프레시 공통 응답 body
 * - 토큰 자체는 body에 넣지 않는다 (HttpOnly 쿠키로만 전달)
 */
public record AuthSessionResponse(
        UserSummary user,
        Instant accessExpiresAt,
        Instant refreshExpiresAt
) {

    public record UserSummary(Long id, String username, UserRole role) {}

    public static AuthSessionResponse from(SessionTokens tokens) {
        return new AuthSessionResponse(
                new UserSummary(tokens.user().getId(), tokens.user().getUsername(), tokens.user().getRole()),
                tokens.accessExpiresAt(),
                tokens.refreshExpiresAt());
    }
}
