package com.redisui.backend.auth.identity.login.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.redisui.backend.audit.domain.AuditAction;
import com.redisui.backend.audit.service.AuditLogger;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.identity.login.support.LoginAttemptGuard;
import com.redisui.backend.auth.identity.login.support.LoginAttemptGuard.LockStatus;
import com.redisui.backend.auth.repo.UserRepository;
import com.redisui.backend.auth.token.dto.SessionTokens;
import com.redisui.backend.auth.token.service.RefreshTokenService;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.global.web.ClientInfo;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 *
 * 순서:
 * 1) 시도 예약 → 잠겨 있거나 진행 중 시도로 한도가 찼으면 비밀번호가 맞아도 423
 * 2) 사용자 조회 + 비밀번호 검증 → 실패하면 실패 1회 기록 후 401
 *    (이번 실패로 잠기면 바로 423)
 * 3) 비활성 계정 → 예약 반납 후 403 (실패 카운트에는 포함하지 않음)
 * 4) 실패 기록 삭제 → 세션 생성 + 토큰 발급
 *
 * 예약은 어떤 경로로 끝나든 한 번 정산된다 (예외면 반납).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    private final LoginAttemptGuard attemptGuard;
    private final RefreshTokenService refreshTokenService;
    private final AuditLogger auditLogger;

    public SessionTokens login(String username, String rawPassword, boolean rememberMe, ClientInfo client) {
        String ip = client.ip();

        LockStatus lock = attemptGuard.reserveAttempt(ip, username);
        if (lock.locked()) {
            auditLogger.log(null, AuditAction.LOGIN_BLOCKED, AuditLogger.RESOURCE_USER, null, username,
                    Map.of("remainingSeconds", lock.remainingSeconds()), client);
            throw locked(lock);
        }

        boolean settled = false;
        try {
            User user = userRepository.findByUsername(username).orElse(null);
            if (user == null || !passwordEncoder.matches(rawPassword, user.getPasswordHash())) {
                LockStatus after = attemptGuard.recordFailure(ip, username);
                settled = true;

                Map<String, Object> details = new LinkedHashMap<>();
                details.put("reason", user == null ? "unknown_user" : "bad_password");
                details.put("remainingAttempts", attemptGuard.remainingAttempts(ip, username));
                auditFailure(user, username, details, client);

                if (after.locked()) {
                    throw locked(after);
                }
                throw new ApiException(ErrorCode.INVALID_CREDENTIALS);
            }

            if (!user.isActive()) {
                attemptGuard.release(ip, username);
                settled = true;

                auditFailure(user, username, Map.of("reason", "account_disabled"), client);
                throw new ApiException(ErrorCode.ACCOUNT_DISABLED);
            }

            attemptGuard.clearOnSuccess(ip, username);
            settled = true;

            SessionTokens tokens = refreshTokenService.issue(user, rememberMe, client);

            auditLogger.log(user.getId(), AuditAction.LOGIN, AuditLogger.RESOURCE_SESSION,
                    String.valueOf(tokens.sessionId()), user.getUsername(),
                    Map.of("remember", rememberMe), client);
            log.info("Login succeeded. userId={}, sessionId={}", user.getId(), tokens.sessionId());

            return tokens;
        } finally {
            if (!settled) {
                attemptGuard.release(ip, username);
            }
        }
    }

    private void auditFailure(User user, String username, Map<String, Object> details, ClientInfo client) {
        Long userId = user == null ? null : user.getId();
        auditLogger.log(userId, AuditAction.LOGIN_FAILED, AuditLogger.RESOURCE_USER,
                userId == null ? null : String.valueOf(userId), username, details, client);
    }

    private static ApiException locked(LockStatus lock) {
        long seconds = lock.remainingSeconds();
        long minutes = Math.max(1, (seconds + 59) / 60);
        return new ApiException(
                ErrorCode.ACCOUNT_LOCKED,
                ErrorCode.ACCOUNT_LOCKED.defaultMessage() + " " + minutes + "분 후 다시 시도해주세요.",
                (int) seconds,
                null);
    }
}
