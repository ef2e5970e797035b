package com.redisui.backend.auth.token.domain;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * [auth_sessions 테이블 매핑 엔티티]
 *
 * 로그인 1회 = 세션 1행. 세션 id는 Access Token의 sid 클레임으로 들어간다.
 * - Access Token(JWT)은 서버에 저장하지 않음
 * - Refresh Token은 원문이 아닌 token_hash(sha256)만 저장
 *
 * refresh 회전 시 행을 지우고 새로 만들지 않고 token_hash를 제자리에서 교체한다.
 * (세션 id ↔ 디바이스 1:1 유지)
 *
 * @Index: idx_auth_sessions_token_hash (refresh 조회는 hash로 하므로 unique 인덱스)
 * @Index: idx_auth_sessions_user_id
 * @Index: idx_auth_sessions_expires_at (만료 세션 정리)
 */
@Getter
@Entity
@Table(name = "auth_sessions", indexes = {
    @Index(name = "idx_auth_sessions_token_hash", columnList = "token_hash", unique = true),
    @Index(name = "idx_auth_sessions_user_id", columnList = "user_id"),
    @Index(name = "idx_auth_sessions_expires_at", columnList = "expires_at")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuthSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "token_hash", nullable = false, unique = true, length = 64, columnDefinition = "char(64)")
    private String tokenHash; // sha256 hex(64자). raw는 저장 금지

    @Column(name = "remember_me", nullable = false)
    private boolean rememberMe;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Column(name = "user_agent", length = 255)
    private String userAgent;

    public static AuthSession open(Long userId, String tokenHash, boolean rememberMe,
                                   LocalDateTime now, LocalDateTime expiresAt,
                                   String ipAddress, String userAgent) {
        AuthSession s = new AuthSession();
        s.userId = userId;
        s.tokenHash = tokenHash;
        s.rememberMe = rememberMe;
        s.expiresAt = expiresAt;
        s.createdAt = now;
        s.lastUsedAt = now;
        s.ipAddress = ipAddress;
        s.userAgent = userAgent;
        return s;
    }

    public boolean isExpired(LocalDateTime now) {
        return !expiresAt.isAfter(now);
    }
}
