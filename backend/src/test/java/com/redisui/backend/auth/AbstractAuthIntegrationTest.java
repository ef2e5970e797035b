package com.redisui.backend.auth;

import java.time.LocalDateTime;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.web.servlet.MockMvc;

import com.redisui.backend.AbstractIntegrationTest;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.identity.login.support.LoginAttemptGuard;
import com.redisui.backend.auth.repo.UserRepository;
import com.redisui.backend.auth.token.repo.AuthSessionRepository;
import com.redisui.backend.auth.token.support.TokenHashUtils;

/**
 * - Auth 통합 테스트에서 매번 반복되는 "DB 초기화 + 기본 유저 생성"을 공통화한 클래스
 * - admin / editor / viewer 세 계정을 같은 비밀번호로 만든다
 * - 로그인 잠금 기록(메모리)도 매번 비운다
 */
public abstract class AbstractAuthIntegrationTest extends AbstractIntegrationTest {

    protected static final String ADMIN = "admin";
    protected static final String EDITOR = "editor";
    protected static final String VIEWER = "viewer";
    protected static final String PASSWORD = "Passw0rd!";

    @Autowired protected MockMvc mvc;
    @Autowired protected UserRepository userRepository;
    @Autowired protected AuthSessionRepository sessionRepository;
    @Autowired protected PasswordEncoder passwordEncoder;
    @Autowired protected LoginAttemptGuard attemptGuard;
    @Autowired protected TokenHashUtils tokenHashUtils;

    @BeforeEach
    void cleanDbAndSeedUsers() {
        sessionRepository.deleteAll();
        userRepository.deleteAll();
        attemptGuard.clearAll();

        seedUser(ADMIN, UserRole.ADMIN, true);
        seedUser(EDITOR, UserRole.EDITOR, true);
        seedUser(VIEWER, UserRole.VIEWER, true);
    }

    protected User seedUser(String username, UserRole role, boolean active) {
        return userRepository.save(User.create(
                username,
                passwordEncoder.encode(PASSWORD),
                role,
                active,
                LocalDateTime.now()));
    }
}
