package com.redisui.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.domain.UserRole;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access Token(JWT) 발급/검증 서비스
 *
 * 클레임: iss / sub(userId) / username / role / sid(세션 id) / iat / exp
 *
 * 발급: issueAccessToken(...) - HS256 서명, exp = now + ttl
 * 검증: verifyAccessToken(token) - 서명/만료/issuer 만 확인
 *   - 세션이 살아있는지는 여기서 보지 않는다 (AuthVerificationService 담당)
 *   - 서명 검증과 세션 검증을 따로 테스트할 수 있게 분리
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String USERNAME_CLAIM = "username";
    private static final String ROLE_CLAIM = "role";
    private static final String SESSION_CLAIM = "sid";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser jwtParser;

    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        // 키 길이가 모자라면 요청 단위가 아니라 기동 단계에서 실패시킨다
        byte[] secretBytes = jwtProps.secret().getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.key = Keys.hmacShaKeyFor(secretBytes);

        // exp 판단도 주입된 Clock 기준 (테스트에서 시간 조작 가능)
        this.jwtParser = Jwts.parserBuilder()
                .requireIssuer(jwtProps.issuer())
                .setSigningKey(this.key)
                .setClock(() -> Date.from(this.clock.instant()))
                .build();
    }

    public Duration accessTtl() {
        return Duration.ofSeconds(jwtProps.accessTtlSeconds());
    }

    public IssuedAccessToken issueAccessToken(Long userId, String username, UserRole role, Long sessionId) {
        return issueAccessToken(userId, username, role, sessionId, accessTtl());
    }

    public IssuedAccessToken issueAccessToken(Long userId, String username, UserRole role, Long sessionId, Duration ttl) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (sessionId == null) throw new IllegalArgumentException("sessionId must not be null");
        if (role == null) throw new IllegalArgumentException("role must not be null");

        Instant now = clock.instant();
        Instant exp = now.plus(ttl);

        String token = Jwts.builder()
                .setIssuer(jwtProps.issuer())                 // iss
                .setSubject(String.valueOf(userId))           // sub
                .claim(USERNAME_CLAIM, username)              // username
                .claim(ROLE_CLAIM, role.code())               // role ("viewer" ...)
                .claim(SESSION_CLAIM, sessionId)              // sid
                .setIssuedAt(Date.from(now))                  // iat
                .setExpiration(Date.from(exp))                // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();

        return new IssuedAccessToken(token, exp);
    }

    /**
     * 서명/만료/issuer 검증 후 클레임 복원
     * 실패하면 InvalidJwtException (HTTP는 모른다. 호출자가 401로 매핑)
     */
    public AccessTokenClaims verifyAccessToken(String token) {
        try {
            if (token == null || token.isBlank())
                throw new JwtException("token is null or blank");

            Claims claims = jwtParser.parseClaimsJws(token).getBody();

            Long userId = parseLong(claims.getSubject(), "sub");
            Long sessionId = parseLong(claims.get(SESSION_CLAIM) == null ? null : String.valueOf(claims.get(SESSION_CLAIM)), SESSION_CLAIM);
            String username = claims.get(USERNAME_CLAIM, String.class);
            String role = claims.get(ROLE_CLAIM, String.class);

            if (username == null || username.isBlank())
                throw new JwtException("username claim missing");
            if (role == null || role.isBlank())
                throw new JwtException("role claim missing");

            return new AccessTokenClaims(
                    userId,
                    username,
                    UserRole.fromCode(role),
                    sessionId,
                    claims.getIssuedAt().toInstant(),
                    claims.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidJwtException("Invalid JWT", e);
        }
    }

    private static Long parseLong(String value, String claimName) {
        if (value == null || value.isBlank())
            throw new JwtException(claimName + " claim missing");
        try {
            return Long.valueOf(value);
        } catch (NumberFormatException ex) {
            throw new JwtException(claimName + " is not a valid Long: " + value, ex);
        }
    }

    public record IssuedAccessToken(String token, Instant expiresAt) {}

    /**
     * "HTTP를 모르는 도메인 예외"
     * - Filter/Service에서 잡아서 ACCESS_INVALID 로 매핑
     */
    public static class InvalidJwtException extends RuntimeException {
        public InvalidJwtException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
