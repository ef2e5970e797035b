package com.redisui.backend.security;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import com.redisui.backend.auth.token.support.AuthCookieUtils;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

/**
 * 요청에서 Access Token 원문 꺼내기
 * - Authorization: Bearer <token> 이 있으면 우선
 * - 없으면 쿠키 (rds_access_token → access_token → token)
 */
@Component
@RequiredArgsConstructor
public class AccessTokenExtractor {

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthCookieUtils cookieUtils;

    public String extract(HttpServletRequest request) {
        String bearer = resolveBearer(request);
        return bearer != null ? bearer : cookieUtils.readAccessToken(request);
    }

    private String resolveBearer(HttpServletRequest request) {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank())
            return null;
        if (!authHeader.startsWith(BEARER_PREFIX))
            return null;

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isBlank() ? null : token;
    }
}
