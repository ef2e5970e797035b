package com.redisui.backend.auth.token.support;

import java.security.SecureRandom;
import java.util.Base64;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

/**
 * Refresh Token 원문 생성기
 *
 * - 48바이트(384bit) SecureRandom → 추측 불가능
 * - Base64 URL-safe, 패딩 없음 → 쿠키 값으로 그대로 사용 가능
 * - 원문은 쿠키로만 내려가고, DB에는 TokenHashUtils로 만든 hash만 저장된다
 */
@Component
@RequiredArgsConstructor
public class TokenGenerator {

    private static final int TOKEN_BYTES = 48;

    private final SecureRandom secureRandom;

    public String generateRefreshToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
