package com.redisui.backend.gateway;

import java.util.List;

import com.redisui.backend.auth.token.dto.SessionTokens;
import com.redisui.backend.auth.token.service.RefreshTokenService;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.web.ClientInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 게이트웨이용 인라인 refresh
 *
 * /api/auth/refresh 와 같은 RefreshTokenService.rotate 를 프로세스 안에서 호출한다.
 * 결과는 예외가 아니라 Outcome 으로 돌려준다. 게이트웨이는 자기 오류로 요청을 실패시키지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class InlineRefresher {

    private final RefreshTokenService refreshTokenService;
    private final AuthCookieUtils cookieUtils;
    private final ClientInfoResolver clientInfoResolver;

    public Outcome tryRefresh(HttpServletRequest request) {
        String refreshRaw = cookieUtils.readRefreshToken(request);
        if (refreshRaw == null) {
            return Outcome.failed(List.of());
        }

        try {
            SessionTokens tokens = refreshTokenService.rotate(refreshRaw, clientInfoResolver.resolve(request));
            return Outcome.refreshed(tokens, cookieUtils.issue(tokens));
        } catch (ApiException e) {
            // 만료/재사용/동시 회전 패배 → 쿠키 정리 후 로그인으로
            return Outcome.failed(cookieUtils.clearAll());
        } catch (RuntimeException e) {
            // 저장소 장애 등. 쿠키는 건드리지 않는다
            log.error("Inline refresh failed unexpectedly. path={}", request.getRequestURI(), e);
            return Outcome.failed(List.of());
        }
    }

    /**
     * @param tokens      성공 시 새 토큰, 실패 시 null
     * @param setCookies  응답에 그대로 붙일 Set-Cookie 값 목록
     */
    public record Outcome(boolean refreshed, SessionTokens tokens, List<String> setCookies) {

        static Outcome refreshed(SessionTokens tokens, List<String> setCookies) {
            return new Outcome(true, tokens, setCookies);
        }

        static Outcome failed(List<String> setCookies) {
            return new Outcome(false, null, setCookies);
        }
    }
}
