package com.redisui.backend.auth.token.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.redisui.backend.auth.token.domain.AuthSession;
import com.redisui.backend.auth.token.domain.LiveSession;
import com.redisui.backend.auth.token.repo.AuthSessionRepository;
import com.redisui.backend.global.web.ClientInfo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 세션 저장소 (auth_sessions)
 *
 * 세션 상태: ACTIVE → (refresh) → ACTIVE(새 hash) / ACTIVE → EXPIRED / * → DELETED(logout)
 *
 * - validateSession: 존재 + 미만료 + 소유자 활성 을 한 쿼리로 판단
 * - rotateSession: 조건부 UPDATE 한 번 (compare-and-swap). false = "로그아웃된 것으로 취급"
 * - 만료 세션은 조회 시 걸러지고, 주기적으로 정리된다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthSessionService {

    private final AuthSessionRepository repo;
    private final Clock clock;

    @Transactional
    public Long createSession(Long userId, String refreshHash, boolean rememberMe,
                              LocalDateTime expiresAt, ClientInfo client) {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        AuthSession saved = repo.save(AuthSession.open(
                userId, refreshHash, rememberMe, now, expiresAt, client.ip(), client.userAgent()));
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Optional<LiveSession> validateSession(Long sessionId, Long userId) {
        if (sessionId == null || userId == null)
            return Optional.empty();
        return repo.findLive(sessionId, userId, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public Optional<LiveSession> findLiveByRefreshHash(String refreshHash) {
        if (refreshHash == null)
            return Optional.empty();
        return repo.findLiveByTokenHash(refreshHash, LocalDateTime.now(clock));
    }

    /**
     * refresh 회전 (CAS)
     * - currentHash 가 여전히 저장된 값일 때만 newHash 로 교체
     * - 동시에 같은 refresh 로 두 번 들어오면 정확히 하나만 true
     */
    @Transactional
    public boolean rotateSession(Long sessionId, String currentHash, String newHash,
                                 LocalDateTime newExpiresAt, ClientInfo client) {
        int updated = repo.rotate(
                sessionId,
                currentHash,
                newHash,
                newExpiresAt,
                LocalDateTime.now(clock),
                client.ip(),
                client.userAgent());
        return updated == 1;
    }

    @Transactional
    public void deleteSession(Long sessionId) {
        if (sessionId == null)
            return;
        repo.deleteSession(sessionId);
    }

    @Scheduled(
            fixedDelayString = "${app.auth.session.cleanup-interval-seconds}",
            initialDelayString = "${app.auth.session.cleanup-interval-seconds}",
            timeUnit = TimeUnit.SECONDS)
    @Transactional
    public void purgeExpired() {
        int deleted = repo.deleteExpired(LocalDateTime.now(clock));
        if (deleted > 0) {
            log.info("Purged expired sessions. count={}", deleted);
        }
    }
}
