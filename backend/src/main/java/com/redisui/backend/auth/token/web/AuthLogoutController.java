package com.redisui.backend.auth.token.web;

import java.util.Map;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.redisui.backend.audit.domain.AuditAction;
import com.redisui.backend.audit.service.AuditLogger;
import com.redisui.backend.auth.token.service.AuthSessionService;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.global.web.ClientInfoResolver;
import com.redisui.backend.security.AuthPrincipal;
import com.redisui.backend.security.AuthVerificationService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 로그아웃
 * - 유효한 access token 필요
 * - 현재 세션(sid)만 삭제. 다른 기기의 세션은 유지
 * - 현재 + 예전 쿠키 이름 5개 모두 삭제
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthLogoutController {

    private final AuthVerificationService verificationService;
    private final AuthSessionService sessionService;
    private final AuthCookieUtils cookieUtils;
    private final AuditLogger auditLogger;
    private final ClientInfoResolver clientInfoResolver;

    // POST: /api/auth/logout
    @PostMapping("/logout")
    public Map<String, Boolean> logout(HttpServletRequest request, HttpServletResponse response) {
        AuthPrincipal principal = verificationService.requireAuth(request);

        sessionService.deleteSession(principal.sessionId());
        cookieUtils.write(response, cookieUtils.clearAll());

        auditLogger.log(principal.userId(), AuditAction.LOGOUT, AuditLogger.RESOURCE_SESSION,
                String.valueOf(principal.sessionId()), principal.username(), null, clientInfoResolver.resolve(request));

        return Map.of("success", true);
    }
}
