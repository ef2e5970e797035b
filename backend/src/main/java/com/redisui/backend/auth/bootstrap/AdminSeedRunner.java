package com.redisui.backend.auth.bootstrap;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import com.redisui.backend.auth.config.BootstrapProperties;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.identity.register.service.RegisterService;
import com.redisui.backend.auth.repo.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 최초 기동 시 관리자 계정 시드
 * - users 테이블이 비어 있을 때만 동작
 * - 계정 정보가 없거나 정책 위반이면 기동 실패
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminSeedRunner implements ApplicationRunner {

    private final BootstrapProperties props;
    private final UserRepository userRepository;
    private final RegisterService registerService;

    @Override
    public void run(ApplicationArguments args) {
        if (!props.enabled()) {
            log.debug("Admin bootstrap disabled");
            return;
        }
        if (userRepository.count() > 0) {
            return;
        }

        if (isBlank(props.adminUsername()) || isBlank(props.adminPassword())) {
            throw new IllegalStateException(
                    "No users exist and app.bootstrap.admin-username / admin-password are not set");
        }

        User admin = registerService.createAccount(props.adminUsername(), props.adminPassword(), UserRole.ADMIN, true);
        log.info("Bootstrap admin created. userId={}, username={}", admin.getId(), admin.getUsername());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
