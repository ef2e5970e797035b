package com.redisui.backend.auth.identity.login.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.redisui.backend.auth.config.AuthProperties;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 무차별 대입 방어 (메모리 기반)
 *
 * 키: "클라이언트 IP:소문자 username"
 * - 윈도우(windowSeconds) 안에서 실패가 maxAttempts 번 쌓이면 lockoutSeconds 동안 잠금
 * - N번째 실패 호출 자체가 카운트되고 그 호출에서 바로 잠긴다 (추가 유예 없음)
 * - 재기동하면 모든 기록이 사라진다 (DB에 저장하지 않음)
 *
 * 동시성: 키 단위로 ConcurrentHashMap.compute 안에서 증가+비교를 원자적으로 처리
 * - 로그인은 비밀번호 검증 전에 reserveAttempt 로 자리를 먼저 잡는다
 * - 확정된 실패 + 진행 중인 시도(pending) 합이 maxAttempts 에 닿으면 더 받지 않는다
 * → 병렬 요청을 몰아 보내도 윈도우당 비밀번호 검증은 maxAttempts 번을 넘지 않는다
 */
@Slf4j
@Component
public class LoginAttemptGuard {

    private final ConcurrentMap<String, AttemptRecord> attempts = new ConcurrentHashMap<>();

    private final AuthProperties.BruteForce policy;
    private final Clock clock;

    public LoginAttemptGuard(AuthProperties props, Clock clock) {
        this.policy = props.bruteForce();
        this.clock = clock;
    }

    /**
     * 잠금 여부 조회
     * - 잠금이 이미 풀린 기록을 만나면 여기서 지운다
     */
    public LockStatus isLocked(String address, String username) {
        String key = key(address, username);
        Instant now = clock.instant();
        AtomicReference<LockStatus> result = new AtomicReference<>(LockStatus.UNLOCKED);

        attempts.computeIfPresent(key, (k, record) -> {
            if (record.lockedUntil() == null) {
                return record;
            }
            if (now.isBefore(record.lockedUntil())) {
                result.set(LockStatus.locked(remainingSeconds(now, record.lockedUntil())));
                return record;
            }
            // 잠금 만료 → 기록 삭제 (진행 중 예약만 남김)
            return record.pending() == 0 ? null : new AttemptRecord(0, now, now, null, record.pending());
        });
        return result.get();
    }

    /**
     * 비밀번호 검증 전 시도 1회 예약
     * - 잠겨 있으면 거절 (남은 잠금 시간)
     * - 실패 + 진행 중 시도가 이미 maxAttempts 이상이면 거절 (lockoutSeconds)
     * - 통과하면 pending 을 1 올리고 UNLOCKED 반환. 이후 recordFailure / clearOnSuccess / release 중 하나로 정산
     */
    public LockStatus reserveAttempt(String address, String username) {
        String key = key(address, username);
        Instant now = clock.instant();
        AtomicReference<LockStatus> result = new AtomicReference<>(LockStatus.UNLOCKED);

        attempts.compute(key, (k, record) -> {
            if (record == null) {
                return new AttemptRecord(0, now, now, null, 1);
            }
            if (record.lockedUntil() != null && now.isBefore(record.lockedUntil())) {
                result.set(LockStatus.locked(remainingSeconds(now, record.lockedUntil())));
                return record;
            }
            if (isOutsideWindow(record, now) || isLockExpired(record, now)) {
                return new AttemptRecord(0, now, now, null, record.pending() + 1);
            }
            if (record.count() + record.pending() >= policy.maxAttempts()) {
                result.set(LockStatus.locked(policy.lockoutSeconds()));
                return record;
            }
            return record.withPending(record.pending() + 1);
        });

        LockStatus status = result.get();
        if (status.locked()) {
            log.warn("security_event=login_attempt_rejected key={} retryAfterSeconds={}", key, status.remainingSeconds());
        }
        return status;
    }

    /** 실패도 성공도 아닌 결과(비활성 계정, 예외)로 끝난 예약 반납 */
    public void release(String address, String username) {
        attempts.computeIfPresent(key(address, username), (k, record) -> {
            AttemptRecord next = record.withPending(Math.max(0, record.pending() - 1));
            return next.isEmpty() ? null : next;
        });
    }

    /**
     * 실패 1회 기록 (예약이 있으면 함께 정산)
     * - 윈도우 밖이면 카운트를 1부터 다시 시작
     * - maxAttempts 에 도달하면 잠금 설정 후 locked=true 반환
     */
    public LockStatus recordFailure(String address, String username) {
        String key = key(address, username);
        Instant now = clock.instant();

        AttemptRecord updated = attempts.compute(key, (k, record) -> {
            AttemptRecord next;
            if (record == null) {
                next = new AttemptRecord(1, now, now, null, 0);
            } else if (isOutsideWindow(record, now) || isLockExpired(record, now)) {
                next = new AttemptRecord(1, now, now, null, Math.max(0, record.pending() - 1));
            } else {
                next = new AttemptRecord(record.count() + 1, record.firstAttempt(), now, record.lockedUntil(),
                        Math.max(0, record.pending() - 1));
            }

            if (next.lockedUntil() == null && next.count() >= policy.maxAttempts()) {
                next = next.lockUntil(now.plusSeconds(policy.lockoutSeconds()));
            }
            return next;
        });

        if (updated.lockedUntil() != null && now.isBefore(updated.lockedUntil())) {
            if (updated.count() == policy.maxAttempts()) {
                log.warn("security_event=login_lock_applied key={} failCount={} lockoutSeconds={}",
                        key, updated.count(), policy.lockoutSeconds());
            }
            return LockStatus.locked(remainingSeconds(now, updated.lockedUntil()));
        }
        return LockStatus.UNLOCKED;
    }

    /**
     * 로그인 성공 시 실패 기록 삭제
     * - 다른 요청의 예약(pending)은 남겨 둔다
     * - 그 사이 걸린 잠금은 풀지 않는다
     */
    public void clearOnSuccess(String address, String username) {
        Instant now = clock.instant();
        attempts.computeIfPresent(key(address, username), (k, record) -> {
            int pending = Math.max(0, record.pending() - 1);
            if (record.lockedUntil() != null && now.isBefore(record.lockedUntil())) {
                return record.withPending(pending);
            }
            return pending == 0 ? null : new AttemptRecord(0, now, now, null, pending);
        });
    }

    /** 잠금까지 남은 시도 횟수 (0 미만으로 내려가지 않음) */
    public int remainingAttempts(String address, String username) {
        AttemptRecord record = attempts.get(key(address, username));
        if (record == null || isOutsideWindow(record, clock.instant())) {
            return policy.maxAttempts();
        }
        return Math.max(0, policy.maxAttempts() - record.count());
    }

    /**
     * 주기적 정리
     * - 잠금이 풀린 기록, 잠금 없이 윈도우가 지난 기록 삭제
     * - removeIf 는 맵 전체를 잠그지 않는다
     */
    @Scheduled(
            fixedDelayString = "${app.auth.brute-force.cleanup-interval-seconds}",
            initialDelayString = "${app.auth.brute-force.cleanup-interval-seconds}",
            timeUnit = TimeUnit.SECONDS)
    public void cleanup() {
        Instant now = clock.instant();
        int before = attempts.size();
        attempts.entrySet().removeIf(e -> isStale(e.getValue(), now));
        int removed = before - attempts.size();
        if (removed > 0) {
            log.debug("Login attempt records cleaned. removed={}, remaining={}", removed, attempts.size());
        }
    }

    // 종료 시 비움. 테스트에서도 상태 초기화 용도로 사용
    @PreDestroy
    public void clearAll() {
        attempts.clear();
    }

    int trackedKeys() {
        return attempts.size();
    }

    private boolean isStale(AttemptRecord record, Instant now) {
        if (record.pending() > 0
                && Duration.between(record.lastAttempt(), now).getSeconds() <= policy.windowSeconds()) {
            return false;
        }
        if (record.lockedUntil() != null) {
            return !now.isBefore(record.lockedUntil());
        }
        return isOutsideWindow(record, now);
    }

    private boolean isOutsideWindow(AttemptRecord record, Instant now) {
        return record.lockedUntil() == null
                && Duration.between(record.firstAttempt(), now).getSeconds() > policy.windowSeconds();
    }

    private static boolean isLockExpired(AttemptRecord record, Instant now) {
        return record.lockedUntil() != null && !now.isBefore(record.lockedUntil());
    }

    private static long remainingSeconds(Instant now, Instant lockedUntil) {
        long millis = Duration.between(now, lockedUntil).toMillis();
        return Math.max(1, (millis + 999) / 1000); // 올림
    }

    private static String key(String address, String username) {
        String addr = (address == null || address.isBlank()) ? "unknown" : address.trim();
        String user = username == null ? "" : username.trim().toLowerCase(Locale.ROOT);
        return addr + ":" + user;
    }

    // pending: 예약했지만 아직 결과가 정산되지 않은 시도 수
    private record AttemptRecord(int count, Instant firstAttempt, Instant lastAttempt, Instant lockedUntil, int pending) {
        AttemptRecord lockUntil(Instant until) {
            return new AttemptRecord(count, firstAttempt, lastAttempt, until, pending);
        }

        AttemptRecord withPending(int value) {
            return new AttemptRecord(count, firstAttempt, lastAttempt, lockedUntil, value);
        }

        boolean isEmpty() {
            return count == 0 && pending == 0 && lockedUntil == null;
        }
    }

    public record LockStatus(boolean locked, Long remainingSeconds) {

        static final LockStatus UNLOCKED = new LockStatus(false, null);

        static LockStatus locked(long remainingSeconds) {
            return new LockStatus(true, remainingSeconds);
        }
    }
}
