package com.redisui.backend.gateway;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriComponentsBuilder;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.token.dto.SessionTokens;
import com.redisui.backend.auth.token.support.AuthCookieNames;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.gateway.GatewayRoutes.RouteType;
import com.redisui.backend.security.JwtService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * 페이지 라우트 앞단 인증 게이트웨이
 *
 * 판단 순서:
 * 1) public 경로 → 그대로 통과
 * 2) access 쿠키 서명/만료 확인 (세션은 보지 않음, 파싱 실패는 토큰 없음과 같다)
 * 3) 보호 페이지 + 토큰 무효 → 인라인 refresh
 *    - 성공: 새 쿠키로 바꾼 요청을 넘기고 Set-Cookie 전부 첨부
 *    - 실패: /login?from=원래경로 로 리다이렉트 (삭제 쿠키 첨부)
 * 4) 로그인 페이지 + 토큰 유효 → 홈으로
 * 5) 로그인 페이지 + 토큰 무효 → 인라인 refresh 성공 시 홈으로, 아니면 로그인 페이지 통과
 */
@Slf4j
public class AuthGatewayFilter extends OncePerRequestFilter {

    private final GatewayRoutes routes;
    private final JwtService jwtService;
    private final AuthCookieUtils cookieUtils;
    private final InlineRefresher refresher;
    private final AuthProperties.Gateway props;

    public AuthGatewayFilter(AuthProperties.Gateway props, JwtService jwtService,
                             AuthCookieUtils cookieUtils, InlineRefresher refresher) {
        this.props = props;
        this.routes = new GatewayRoutes(props);
        this.jwtService = jwtService;
        this.cookieUtils = cookieUtils;
        this.refresher = refresher;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain chain
    ) throws ServletException, IOException {

        String path = pathOf(request);
        RouteType type = routes.classify(path);

        if (type == RouteType.PUBLIC || type == RouteType.OTHER) {
            chain.doFilter(request, response);
            return;
        }

        boolean accessValid = hasValidAccessToken(request);

        if (type == RouteType.PROTECTED) {
            if (accessValid) {
                chain.doFilter(request, response);
                return;
            }

            InlineRefresher.Outcome outcome = refresher.tryRefresh(request);
            cookieUtils.write(response, outcome.setCookies());

            if (outcome.refreshed()) {
                chain.doFilter(rewrite(request, outcome.tokens()), response);
            } else {
                redirect(response, loginRedirect(path));
            }
            return;
        }

        // AUTH_ONLY
        if (accessValid) {
            redirect(response, props.homePath());
            return;
        }

        InlineRefresher.Outcome outcome = refresher.tryRefresh(request);
        cookieUtils.write(response, outcome.setCookies());

        if (outcome.refreshed()) {
            redirect(response, props.homePath());
        } else {
            chain.doFilter(request, response);
        }
    }

    private boolean hasValidAccessToken(HttpServletRequest request) {
        String token = cookieUtils.readAccessToken(request);
        if (token == null) return false;

        try {
            jwtService.verifyAccessToken(token);
            return true;
        } catch (RuntimeException e) {
            log.debug("Gateway access token rejected: {}", e.getMessage());
            return false;
        }
    }

    private String loginRedirect(String from) {
        return UriComponentsBuilder.fromPath(props.loginPath())
                .queryParam("from", from)
                .encode()
                .build()
                .toUriString();
    }

    private static void redirect(HttpServletResponse response, String location) {
        response.setStatus(HttpStatus.FOUND.value());
        response.setHeader(HttpHeaders.LOCATION, location);
    }

    private static HttpServletRequest rewrite(HttpServletRequest request, SessionTokens tokens) {
        return new CookieRewritingRequest(
                request,
                Map.of(AuthCookieNames.ACCESS, tokens.accessToken(),
                        AuthCookieNames.REFRESH, tokens.refreshRaw()),
                List.copyOf(AuthCookieNames.LEGACY));
    }

    private static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String context = request.getContextPath();
        if (context != null && !context.isEmpty() && uri.startsWith(context)) {
            uri = uri.substring(context.length());
        }
        return uri.isEmpty() ? "/" : uri;
    }
}
