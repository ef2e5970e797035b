package com.redisui.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 최초 기동 시 관리자 계정 시드 설정 (app.bootstrap.*)
 * - users 테이블이 비어 있을 때만 사용된다 (AdminSeedRunner)
 * - 값이 비어 있으면 시드가 필요한 시점에 기동을 중단한다
 */
@Validated
@ConfigurationProperties(prefix = "app.bootstrap")
public record BootstrapProperties(
        boolean enabled,
        String adminUsername,
        String adminPassword
) {}
