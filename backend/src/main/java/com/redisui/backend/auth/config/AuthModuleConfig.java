package com.redisui.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import com.redisui.backend.global.web.ClientProperties;

/**
 * 인증 모듈 공통 빈
 * - Clock: 모든 만료 계산의 기준 시각 (DB에는 UTC LocalDateTime으로 저장)
 * - @EnableScheduling: 로그인 실패 기록/만료 세션 정리 작업
 * - @EnableAsync: 감사 로그 비동기 기록
 */
@Configuration
@EnableScheduling
@EnableAsync
@EnableConfigurationProperties({AuthProperties.class, BootstrapProperties.class, ClientProperties.class})
public class AuthModuleConfig {

    private static final int BCRYPT_STRENGTH = 10;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecureRandom secureRandom() {
        // getInstanceStrong()는 환경에 따라 블로킹될 수 있어서 new SecureRandom() 사용
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }
}
