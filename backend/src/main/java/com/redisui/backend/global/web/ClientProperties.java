package com.redisui.backend.global.web;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 클라이언트 식별 설정 (app.client.*)
 * - trustForwardedHeaders: X-Forwarded-For / X-Real-IP / CF-Connecting-IP 를 믿을지 여부
 *   신뢰하는 리버스 프록시 뒤에서만 true. 기본 false (소켓 주소만 사용)
 */
@ConfigurationProperties(prefix = "app.client")
public record ClientProperties(boolean trustForwardedHeaders) {}
