package com.redisui.backend.auth.token.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.springframework.stereotype.Component;

/**
 * refresh token 해시 유틸
 * - incoming raw token -> sha256Hex -> auth_sessions.token_hash 와 비교
 */
@Component
public class TokenHashUtils {

    public String sha256Hex(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("raw token must not be null");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(raw.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(digest.length * 2);
            for (byte b : digest) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // SHA-256이 없으면 시스템이 정상 동작 불가 수준
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
