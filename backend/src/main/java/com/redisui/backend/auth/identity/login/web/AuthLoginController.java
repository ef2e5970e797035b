package com.redisui.backend.auth.identity.login.web;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.redisui.backend.auth.identity.login.dto.LoginRequest;
import com.redisui.backend.auth.identity.login.service.LoginService;
import com.redisui.backend.auth.token.dto.AuthSessionResponse;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.global.web.ClientInfoResolver;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

/**
 * 로그인 API 컨트롤러 (얇게 유지)
 *
 * Response
 * - Set-Cookie: rds_access_token=...; rds_refresh_token=...; 예전 이름 3개는 삭제
 * - Body: { "user": {id, username, role}, "accessExpiresAt": ..., "refreshExpiresAt": ... }
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthLoginController {

    private final LoginService loginService;
    private final AuthCookieUtils cookieUtils;
    private final ClientInfoResolver clientInfoResolver;

    // POST: /api/auth/login
    @PostMapping("/login")
    public AuthSessionResponse login(
            @Valid @RequestBody LoginRequest req,
            HttpServletRequest request,
            HttpServletResponse response
    ) {
        var tokens = loginService.login(
                req.username(),
                req.password(),
                req.rememberOrFalse(),
                clientInfoResolver.resolve(request));

        cookieUtils.write(response, cookieUtils.issue(tokens));
        return AuthSessionResponse.from(tokens);
    }
}
