package com.redisui.backend.security;

import java.time.Instant;

import com.redisui.backend.auth.domain.UserRole;

/**
 * 서명 검증을 통과한 Access Token 클레임
 * - 아직 세션 생존 여부는 확인되지 않은 상태
 */
public record AccessTokenClaims(
        Long userId,
        String username,
        UserRole role,
        Long sessionId,
        Instant issuedAt,
        Instant expiresAt
) {}
