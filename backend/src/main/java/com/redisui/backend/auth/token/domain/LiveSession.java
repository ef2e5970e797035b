package com.redisui.backend.auth.token.domain;

import com.redisui.backend.auth.domain.User;

/**
 * "살아있는 세션" 조회 결과
 * - 세션 존재 + 미만료 + 소유자 활성 상태를 한 쿼리로 확인한 결과만 담긴다
 */
public record LiveSession(AuthSession session, User user) {}
