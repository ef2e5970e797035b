package com.redisui.backend.auth.identity.register.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.redisui.backend.audit.domain.AuditAction;
import com.redisui.backend.audit.service.AuditLogger;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.identity.password.PasswordPolicy;
import com.redisui.backend.auth.repo.UserRepository;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.global.web.ClientInfo;
import com.redisui.backend.security.AuthPrincipal;

import lombok.RequiredArgsConstructor;

/**
 * 사용자 등록
 * - 호출자는 editor 이상 (컨트롤러에서 확인)
 * - editor 는 admin 계정을 만들 수 없다 (403)
 * - 아이디 형식 → 비밀번호 정책 → 중복 순으로 검사
 */
@Service
@RequiredArgsConstructor
public class RegisterService {

    public static final Pattern USERNAME_PATTERN = Pattern.compile("^[a-zA-Z0-9_]{3,50}$");

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicy passwordPolicy;
    private final AuditLogger auditLogger;
    private final Clock clock;

    @Transactional
    public User register(AuthPrincipal actor, String username, String rawPassword,
                         UserRole role, boolean active, ClientInfo client) {
        if (role == UserRole.ADMIN && actor.role() != UserRole.ADMIN) {
            throw new ApiException(ErrorCode.FORBIDDEN, "관리자 계정은 관리자만 생성할 수 있습니다.");
        }

        User created = createAccount(username, rawPassword, role, active);

        auditLogger.log(actor.userId(), AuditAction.USER_CREATED, AuditLogger.RESOURCE_USER,
                String.valueOf(created.getId()), created.getUsername(),
                Map.of("role", role.code(), "isActive", active), client);
        return created;
    }

    /**
     * 권한 확인 없이 계정 생성 (등록 API, 최초 관리자 시드 공용)
     */
    @Transactional
    public User createAccount(String username, String rawPassword, UserRole role, boolean active) {
        if (username == null || !USERNAME_PATTERN.matcher(username).matches()) {
            throw new ApiException(ErrorCode.INVALID_USERNAME);
        }

        passwordPolicy.validate(rawPassword);

        if (userRepository.existsByUsername(username)) {
            throw new ApiException(ErrorCode.USERNAME_ALREADY_EXISTS);
        }

        try {
            return userRepository.saveAndFlush(User.create(
                    username,
                    passwordEncoder.encode(rawPassword),
                    role,
                    active,
                    LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            // exists 확인과 insert 사이에 같은 아이디가 먼저 들어온 경우
            throw new ApiException(ErrorCode.USERNAME_ALREADY_EXISTS);
        }
    }
}
