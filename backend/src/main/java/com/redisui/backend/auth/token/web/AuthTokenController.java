package com.redisui.backend.auth.token.web;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.redisui.backend.auth.token.dto.AuthSessionResponse;
import com.redisui.backend.auth.token.service.RefreshTokenService;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.global.ApiError;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.global.web.ClientInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 토큰 재발급 API
 *
 * - refresh 쿠키만 읽는다 (access 토큰은 보지 않음)
 * - 실패는 항상 401 REFRESH_INVALID + 인증 쿠키 5종 삭제. 500 으로 번지지 않는다
 * - 쿠키가 아예 없으면 세션 저장소를 건드리지 않는다
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthTokenController {

    private final RefreshTokenService refreshTokenService;
    private final AuthCookieUtils cookieUtils;
    private final ClientInfoResolver clientInfoResolver;

    // POST: /api/auth/refresh
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh(HttpServletRequest request) {
        String refreshRaw = cookieUtils.readRefreshToken(request);

        if (refreshRaw == null) {
            return rejected(new ApiException(ErrorCode.REFRESH_INVALID));
        }

        try {
            var tokens = refreshTokenService.rotate(refreshRaw, clientInfoResolver.resolve(request));
            return ResponseEntity.ok()
                    .header(HttpHeaders.SET_COOKIE, cookieUtils.issue(tokens).toArray(String[]::new))
                    .body(AuthSessionResponse.from(tokens));
        } catch (ApiException e) {
            return rejected(e);
        }
    }

    private ResponseEntity<ApiError> rejected(ApiException e) {
        return ResponseEntity.status(e.getStatus())
                .header(HttpHeaders.SET_COOKIE, cookieUtils.clearAll().toArray(String[]::new))
                .body(ApiError.of(e.getCode(), e.getMessage()));
    }
}
