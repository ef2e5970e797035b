package com.redisui.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - 모든 HTTP 요청은 컨트롤러에 도달하기 전에 Security Filter Chain 을 통과
 * - /api/** 는 여기서 "서명이 유효한 토큰이 있는지" 까지만 본다
 * - 세션 생존/권한은 각 핸들러가 AuthVerificationService 로 다시 확인
 * - 페이지 라우트는 AuthGatewayFilter 가 담당하므로 여기서는 열어둔다
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final AccessTokenExtractor tokenExtractor;
    private final SecurityErrorWriter errorWriter;

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable()) // SameSite=Strict 쿠키 + JSON API
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable()) // /api/auth/logout 은 직접 구현
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(new RestAuthEntryPoint(errorWriter))
                )

                .addFilterBefore(
                        new JwtAuthenticationFilter(jwtService, tokenExtractor),
                        UsernamePasswordAuthenticationFilter.class
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // 공개 auth 엔드포인트
                        .requestMatchers(HttpMethod.POST, "/api/auth/login").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/auth/refresh").permitAll()

                        // 나머지 API는 인증 필요 (/api/auth/me, logout, register 포함)
                        .requestMatchers("/api/**").authenticated()

                        // 페이지 라우트는 게이트웨이가 처리
                        .anyRequest().permitAll()
                )
                .build();
    }
}
