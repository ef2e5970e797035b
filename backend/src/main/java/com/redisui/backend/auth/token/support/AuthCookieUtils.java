package com.redisui.backend.auth.token.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.token.dto.SessionTokens;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 인증 쿠키 유틸 (access + refresh)
 *
 * - 두 토큰 모두 HttpOnly 쿠키로 내려서 JS에서 접근 못하게 한다
 * - 속성: HttpOnly; SameSite=Strict; Path=/; Max-Age=n; (prod) Secure
 * - Set-Cookie는 항상 "값 목록"으로 다룬다. 쿠키 하나당 헤더 하나.
 *   (게이트웨이가 이 목록을 그대로 응답에 옮겨 담는다)
 *
 * ResponseCookie: Spring이 제공하는 Set-Cookie 헤더 문자열 생성기
 */
@Component
@RequiredArgsConstructor
public class AuthCookieUtils {

    private final AuthProperties props;

    /** access 쿠키 읽기: 현재 이름 → access_token → token */
    public String readAccessToken(HttpServletRequest request) {
        return readFirst(request.getCookies(), AuthCookieNames.ACCESS_READ_ORDER);
    }

    /** refresh 쿠키 읽기: 현재 이름 → refresh_token */
    public String readRefreshToken(HttpServletRequest request) {
        return readFirst(request.getCookies(), AuthCookieNames.REFRESH_READ_ORDER);
    }

    /**
     * 로그인/리프레시 성공 시 내려줄 Set-Cookie 목록
     * - access: Max-Age = access TTL
     * - refresh: Max-Age = 세션 남은 수명
     * - 예전 이름 3개는 삭제 쿠키
     */
    public List<String> issue(String accessToken, Duration accessMaxAge, String refreshRaw, Duration refreshMaxAge) {
        List<String> headers = new ArrayList<>(2 + AuthCookieNames.LEGACY.size());
        headers.add(build(AuthCookieNames.ACCESS, accessToken, accessMaxAge));
        headers.add(build(AuthCookieNames.REFRESH, refreshRaw, refreshMaxAge));
        AuthCookieNames.LEGACY.forEach(name -> headers.add(expire(name)));
        return headers;
    }

    public List<String> issue(SessionTokens tokens) {
        return issue(
                tokens.accessToken(),
                Duration.ofSeconds(props.jwt().accessTtlSeconds()),
                tokens.refreshRaw(),
                tokens.refreshMaxAge());
    }

    /** 현재 + 예전 이름 5개 전부 삭제 */
    public List<String> clearAll() {
        return AuthCookieNames.ALL.stream().map(this::expire).toList();
    }

    public void write(HttpServletResponse response, List<String> setCookieHeaders) {
        setCookieHeaders.forEach(h -> response.addHeader(HttpHeaders.SET_COOKIE, h));
    }

    private String build(String name, String value, Duration maxAge) {
        var c = props.cookie();
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(c.secure())
                .path(c.path())
                .sameSite(c.sameSite())
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build()
                .toString();
    }

    private String expire(String name) {
        return build(name, "", Duration.ZERO);
    }

    static String readFirst(Cookie[] cookies, List<String> names) {
        if (cookies == null || cookies.length == 0)
            return null;

        for (String name : names) {
            String value = Arrays.stream(cookies)
                    .filter(cookie -> name.equals(cookie.getName()))
                    .map(Cookie::getValue)
                    .filter(v -> v != null && !v.isBlank())
                    .findFirst()
                    .orElse(null);
            if (value != null)
                return value;
        }
        return null;
    }
}
