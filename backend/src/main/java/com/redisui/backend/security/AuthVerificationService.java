package com.redisui.backend.security;

import java.util.Arrays;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.token.domain.LiveSession;
import com.redisui.backend.auth.token.service.AuthSessionService;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 핸들러 쪽 인증 검증 (권위 있는 검사)
 *
 * 1) 토큰 추출 (Bearer → access 쿠키 3종)
 * 2) 서명/만료 검증
 * 3) 세션 생존 확인: sid 세션 존재 + 미만료 + sub 일치 + 사용자 활성
 *
 * JwtAuthenticationFilter 나 게이트웨이는 2) 까지만 본다.
 * 반환되는 AuthPrincipal 의 username/role 은 토큰이 아닌 DB 값이다.
 */
@Service
@RequiredArgsConstructor
public class AuthVerificationService {

    private final JwtService jwtService;
    private final AuthSessionService sessionService;
    private final AccessTokenExtractor tokenExtractor;

    /** 실패 사유를 구분하지 않는 조회용 */
    public Optional<AuthPrincipal> verify(HttpServletRequest request) {
        try {
            return Optional.of(requireAuth(request));
        } catch (ApiException e) {
            return Optional.empty();
        }
    }

    /**
     * 인증 필수
     * - 토큰 없음 → AUTH_REQUIRED
     * - 서명/만료 실패 → ACCESS_INVALID
     * - 세션 종료/만료, 사용자 비활성 → SESSION_EXPIRED
     */
    public AuthPrincipal requireAuth(HttpServletRequest request) {
        String token = tokenExtractor.extract(request);
        if (token == null) {
            throw new ApiException(ErrorCode.AUTH_REQUIRED);
        }

        AccessTokenClaims claims;
        try {
            claims = jwtService.verifyAccessToken(token);
        } catch (JwtService.InvalidJwtException e) {
            throw new ApiException(ErrorCode.ACCESS_INVALID);
        }

        LiveSession live = sessionService.validateSession(claims.sessionId(), claims.userId())
                .orElseThrow(() -> new ApiException(ErrorCode.SESSION_EXPIRED));

        User user = live.user();
        return new AuthPrincipal(user.getId(), user.getUsername(), user.getRole(), claims.sessionId());
    }

    /**
     * 계층 권한 검사: admin ⊇ editor ⊇ viewer
     * - 인증 실패는 401, 권한 부족은 403 (FORBIDDEN)
     */
    public AuthPrincipal requireRole(HttpServletRequest request, UserRole required) {
        AuthPrincipal principal = requireAuth(request);
        if (!principal.role().satisfies(required)) {
            throw new ApiException(ErrorCode.FORBIDDEN);
        }
        return principal;
    }

    /** 나열된 권한 중 하나와 정확히 일치해야 통과 (계층 무시) */
    public AuthPrincipal requireAnyRole(HttpServletRequest request, UserRole... allowed) {
        AuthPrincipal principal = requireAuth(request);
        if (Arrays.stream(allowed).noneMatch(r -> r == principal.role())) {
            throw new ApiException(ErrorCode.FORBIDDEN);
        }
        return principal;
    }
}
