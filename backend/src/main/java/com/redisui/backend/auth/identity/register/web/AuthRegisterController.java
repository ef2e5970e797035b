package com.redisui.backend.auth.identity.register.web;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.identity.register.dto.RegisterRequest;
import com.redisui.backend.auth.identity.register.dto.RegisterResponse;
import com.redisui.backend.auth.identity.register.service.RegisterService;
import com.redisui.backend.global.web.ClientInfoResolver;
import com.redisui.backend.security.AuthPrincipal;
import com.redisui.backend.security.AuthVerificationService;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/auth")
public class AuthRegisterController {

    private final AuthVerificationService verificationService;
    private final RegisterService registerService;
    private final ClientInfoResolver clientInfoResolver;

    // POST: /api/auth/register (editor 이상)
    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    public RegisterResponse register(@Valid @RequestBody RegisterRequest req, HttpServletRequest request) {
        AuthPrincipal actor = verificationService.requireRole(request, UserRole.EDITOR);

        var user = registerService.register(
                actor,
                req.username(),
                req.password(),
                req.role(),
                req.activeOrTrue(),
                clientInfoResolver.resolve(request));

        return RegisterResponse.from(user);
    }
}
