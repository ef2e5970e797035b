package com.redisui.backend.auth.token.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.redisui.backend.audit.domain.AuditAction;
import com.redisui.backend.audit.service.AuditLogger;
import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.token.domain.AuthSession;
import com.redisui.backend.auth.token.domain.LiveSession;
import com.redisui.backend.auth.token.dto.SessionTokens;
import com.redisui.backend.auth.token.support.TokenGenerator;
import com.redisui.backend.auth.token.support.TokenHashUtils;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.global.web.ClientInfo;
import com.redisui.backend.security.JwtService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Refresh Token 발급 / 회전 서비스
 *
 * Refresh Token: Access Token이 만료됐을 때 재로그인 없이 새 Access Token을 받기 위한 토큰
 * - 원문은 HttpOnly 쿠키로만, DB에는 sha256 해시만 저장
 * - 매 refresh 마다 새 값으로 교체 (1회용)
 *
 * remember 정책
 * - remember=true  → 세션 수명 rememberMeSeconds (기본 30일)
 * - remember=false → 세션 수명 sessionTtlSeconds (기본 1일)
 *
 * 회전 시 세션 만료 시각은 바꾸지 않는다 (로그인 시점 기준 절대 만료)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RefreshTokenService {

    private final AuthSessionService sessionService;
    private final JwtService jwtService;

    private final TokenGenerator tokenGenerator;
    private final TokenHashUtils hashUtils;
    private final AuditLogger auditLogger;

    private final AuthProperties props;
    private final Clock clock;

    /**
     * 로그인 성공 후 세션 생성 + 토큰 발급
     * - refresh raw 생성 → hash → 세션 저장
     * - 저장된 세션 id(sid)를 넣어서 access token 발급
     */
    @Transactional
    public SessionTokens issue(User user, boolean rememberMe, ClientInfo client) {
        if (user == null || user.getId() == null) {
            throw new IllegalArgumentException("user must be persisted");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiresAt = now.plusSeconds(resolveTtlSeconds(rememberMe));

        String raw = tokenGenerator.generateRefreshToken();
        Long sessionId = sessionService.createSession(user.getId(), hashUtils.sha256Hex(raw), rememberMe, expiresAt, client);

        return tokens(user, sessionId, raw, now, expiresAt);
    }

    /**
     * Refresh Token 회전
     *
     * 1) raw → hash → 살아있는 세션 조회 (미만료 + 소유자 활성)
     * 2) 새 refresh / access 발급
     * 3) CAS 로 hash 교체. 다른 요청이 먼저 회전했으면 실패
     *
     * 어떤 실패든 REFRESH_INVALID 하나로 뭉갠다. 재시도하지 않는다.
     */
    @Transactional
    public SessionTokens rotate(String refreshRaw, ClientInfo client) {
        if (refreshRaw == null || refreshRaw.isBlank()) {
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        String currentHash = hashUtils.sha256Hex(refreshRaw);
        LiveSession live = sessionService.findLiveByRefreshHash(currentHash)
                .orElseThrow(() -> {
                    log.warn("security_event=refresh_rejected reason=unknown_or_expired ip={}", client.ip());
                    return new ApiException(ErrorCode.REFRESH_INVALID);
                });

        AuthSession session = live.session();
        User user = live.user();
        LocalDateTime now = LocalDateTime.now(clock);

        String newRaw = tokenGenerator.generateRefreshToken();
        boolean rotated = sessionService.rotateSession(
                session.getId(),
                currentHash,
                hashUtils.sha256Hex(newRaw),
                session.getExpiresAt(),
                client);

        if (!rotated) {
            log.warn("security_event=refresh_rejected reason=concurrent_rotation sessionId={} ip={}",
                    session.getId(), client.ip());
            throw new ApiException(ErrorCode.REFRESH_INVALID);
        }

        auditLogger.log(user.getId(), AuditAction.REFRESH, AuditLogger.RESOURCE_SESSION,
                String.valueOf(session.getId()), user.getUsername(), null, client);

        return tokens(user, session.getId(), newRaw, now, session.getExpiresAt());
    }

    private SessionTokens tokens(User user, Long sessionId, String refreshRaw,
                                 LocalDateTime now, LocalDateTime refreshExpiresAt) {
        var access = jwtService.issueAccessToken(user.getId(), user.getUsername(), user.getRole(), sessionId);
        return new SessionTokens(
                user,
                sessionId,
                access.token(),
                access.expiresAt(),
                refreshRaw,
                refreshExpiresAt.atZone(clock.getZone()).toInstant(),
                Duration.between(now, refreshExpiresAt));
    }

    private long resolveTtlSeconds(boolean rememberMe) {
        return rememberMe
                ? props.session().rememberMeSeconds()
                : props.session().sessionTtlSeconds();
    }
}
