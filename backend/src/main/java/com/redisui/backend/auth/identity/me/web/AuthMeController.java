package com.redisui.backend.auth.identity.me.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.redisui.backend.auth.identity.me.dto.MeResponse;
import com.redisui.backend.security.AuthPrincipal;
import com.redisui.backend.security.AuthVerificationService;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthMeController {

    private final AuthVerificationService verificationService;

    // GET: /api/auth/me (세션 생존 + 활성 사용자까지 확인)
    @GetMapping("/me")
    public MeResponse me(HttpServletRequest request) {
        AuthPrincipal principal = verificationService.requireAuth(request);
        return new MeResponse(principal.userId(), principal.username(), principal.role());
    }
}
