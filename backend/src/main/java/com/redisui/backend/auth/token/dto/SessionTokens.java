package com.redisui.backend.auth.token.dto;

import java.time.Duration;
import java.time.Instant;

import com.redisui.backend.auth.domain.User;

/**
 * 로그인/리프레시 성공 결과 (서비스 내부 결과)
 * - accessToken / refreshRaw: 쿠키로 내려감
 * - refreshMaxAge: 세션 남은 수명 (refresh 쿠키 Max-Age)
 */
public record SessionTokens(
        User user,
        Long sessionId,
        String accessToken,
        Instant accessExpiresAt,
        String refreshRaw,
        Instant refreshExpiresAt,
        Duration refreshMaxAge
) {}
