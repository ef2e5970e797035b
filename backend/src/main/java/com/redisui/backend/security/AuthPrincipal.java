package com.redisui.backend.security;

import com.redisui.backend.auth.domain.UserRole;

/**
 * 인증 완료 후 SecurityContext / 컨트롤러로 전달되는 "로그인 사용자 정보"
 *
 * - JwtAuthenticationFilter: 서명만 확인된 토큰으로 만든다 (fast path)
 * - AuthVerificationService: 세션/활성 상태까지 확인한 뒤 DB 값으로 만든다
 */
public record AuthPrincipal(Long userId, String username, UserRole role, Long sessionId) {

    static AuthPrincipal from(AccessTokenClaims claims) {
        return new AuthPrincipal(claims.userId(), claims.username(), claims.role(), claims.sessionId());
    }
}
