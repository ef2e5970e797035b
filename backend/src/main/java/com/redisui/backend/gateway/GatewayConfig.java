package com.redisui.backend.gateway;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.token.service.RefreshTokenService;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.global.web.ClientInfoResolver;
import com.redisui.backend.security.JwtService;

/**
 * 게이트웨이 필터 등록
 * Spring Security 체인(-100)보다 앞에서 페이지 라우트를 처리한다.
 */
@Configuration
public class GatewayConfig {

    static final int GATEWAY_ORDER = Ordered.HIGHEST_PRECEDENCE + 50;

    @Bean
    InlineRefresher inlineRefresher(RefreshTokenService refreshTokenService, AuthCookieUtils cookieUtils,
                                    ClientInfoResolver clientInfoResolver) {
        return new InlineRefresher(refreshTokenService, cookieUtils, clientInfoResolver);
    }

    @Bean
    FilterRegistrationBean<AuthGatewayFilter> authGatewayFilter(
            AuthProperties props,
            JwtService jwtService,
            AuthCookieUtils cookieUtils,
            InlineRefresher inlineRefresher
    ) {
        var registration = new FilterRegistrationBean<>(
                new AuthGatewayFilter(props.gateway(), jwtService, cookieUtils, inlineRefresher));
        registration.setName("authGatewayFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(GATEWAY_ORDER);
        return registration;
    }
}
