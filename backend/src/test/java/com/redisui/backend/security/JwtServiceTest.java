package com.redisui.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.support.MutableClock;
import com.redisui.backend.support.TestAuthProperties;

@DisplayName("[Security][JWT] JwtService 단위 테스트")
class JwtServiceTest {

    private MutableClock clock;
    private JwtService jwtService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        jwtService = new JwtService(TestAuthProperties.defaults(), clock);
    }

    @Test
    @DisplayName("발급한 토큰을 검증하면 클레임이 그대로 복원된다")
    void issue_then_verify() {
        var issued = jwtService.issueAccessToken(7L, "alice", UserRole.EDITOR, 42L);

        AccessTokenClaims claims = jwtService.verifyAccessToken(issued.token());

        assertThat(claims.userId()).isEqualTo(7L);
        assertThat(claims.username()).isEqualTo("alice");
        assertThat(claims.role()).isEqualTo(UserRole.EDITOR);
        assertThat(claims.sessionId()).isEqualTo(42L);
        assertThat(claims.issuedAt()).isEqualTo(clock.instant());
        assertThat(claims.expiresAt()).isEqualTo(clock.instant().plusSeconds(900));
        assertThat(issued.expiresAt()).isEqualTo(claims.expiresAt());
    }

    @Test
    @DisplayName("TTL 이 지나면 검증 실패 (주입된 Clock 기준)")
    void expired_token_is_rejected() {
        var issued = jwtService.issueAccessToken(1L, "bob", UserRole.VIEWER, 1L, Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(61));

        assertThatThrownBy(() -> jwtService.verifyAccessToken(issued.token()))
                .isInstanceOf(JwtService.InvalidJwtException.class);
    }

    @Test
    @DisplayName("다른 키로 서명된 토큰은 거부")
    void foreign_signature_is_rejected() {
        AuthProperties d = TestAuthProperties.defaults();
        JwtService other = new JwtService(new AuthProperties(
                new AuthProperties.Jwt("redis-ui", 900, "another-secret-key-that-is-long-enough-0000"),
                d.session(), d.cookie(), d.bruteForce(), d.password(), d.gateway()), clock);

        String foreign = other.issueAccessToken(1L, "mallory", UserRole.ADMIN, 1L).token();

        assertThatThrownBy(() -> jwtService.verifyAccessToken(foreign))
                .isInstanceOf(JwtService.InvalidJwtException.class);
    }

    @Test
    @DisplayName("issuer 가 다르면 거부")
    void wrong_issuer_is_rejected() {
        AuthProperties d = TestAuthProperties.defaults();
        JwtService otherIssuer = new JwtService(new AuthProperties(
                new AuthProperties.Jwt("someone-else", 900, TestAuthProperties.SECRET),
                d.session(), d.cookie(), d.bruteForce(), d.password(), d.gateway()), clock);

        String token = otherIssuer.issueAccessToken(1L, "eve", UserRole.VIEWER, 1L).token();

        assertThatThrownBy(() -> jwtService.verifyAccessToken(token))
                .isInstanceOf(JwtService.InvalidJwtException.class);
    }

    @Test
    @DisplayName("빈 문자열/쓰레기 값은 InvalidJwtException")
    void garbage_is_rejected() {
        assertThatThrownBy(() -> jwtService.verifyAccessToken(""))
                .isInstanceOf(JwtService.InvalidJwtException.class);
        assertThatThrownBy(() -> jwtService.verifyAccessToken("not.a.jwt"))
                .isInstanceOf(JwtService.InvalidJwtException.class);
    }

    @Test
    @DisplayName("32바이트 미만 secret 은 생성 시점에 실패")
    void short_secret_fails_fast() {
        AuthProperties d = TestAuthProperties.defaults();
        AuthProperties weak = new AuthProperties(
                new AuthProperties.Jwt("redis-ui", 900, "too-short"),
                d.session(), d.cookie(), d.bruteForce(), d.password(), d.gateway());

        assertThatThrownBy(() -> new JwtService(weak, clock))
                .isInstanceOf(IllegalStateException.class);
    }
}
