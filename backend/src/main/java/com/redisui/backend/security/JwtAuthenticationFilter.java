package com.redisui.backend.security;

import java.io.IOException;
import java.util.List;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Security Filter Chain에서 동작하는 JWT 인증 필터 (fast path)
 *
 * - Bearer 헤더 또는 access 쿠키에서 토큰을 꺼낸다
 * - 서명/만료만 확인해서 AuthPrincipal 을 SecurityContext 에 넣는다
 * - 세션 생존 여부는 보지 않는다. 핸들러가 AuthVerificationService 로 다시 확인
 *
 * 주의:
 * - 토큰이 invalid 여도 여기서 바로 401을 내리지 않는다.
 *   login/refresh 같은 공개 엔드포인트가 오래된 쿠키 때문에 막히면 안 되기 때문.
 *   대신 요청 속성에 표시만 해두고, 보호된 엔드포인트라면 EntryPoint 가 ACCESS_INVALID 로 응답한다.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String ACCESS_INVALID_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".ACCESS_INVALID";

    private final JwtService jwtService;
    private final AccessTokenExtractor tokenExtractor;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        if (SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = tokenExtractor.extract(request);
        if (token == null) {
            filterChain.doFilter(request, response);
            return;
        }

        try {
            AuthPrincipal principal = AuthPrincipal.from(jwtService.verifyAccessToken(token));

            // Spring Security 권한 모델로 변환 (ROLE_ 접두사 관례)
            var authorities = List.of(new SimpleGrantedAuthority("ROLE_" + principal.role().name()));

            var authentication = new UsernamePasswordAuthenticationToken(principal, null, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);

        } catch (JwtService.InvalidJwtException ex) {
            log.debug("Access token rejected: {}", ex.getMessage());
            SecurityContextHolder.clearContext();
            request.setAttribute(ACCESS_INVALID_ATTRIBUTE, Boolean.TRUE);
        }

        filterChain.doFilter(request, response);
    }
}
