package com.redisui.backend.security;

import java.io.IOException;

import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import com.redisui.backend.global.ErrorCode;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * 인증이 필요한 엔드포인트에 인증 없이 접근했을 때 호출되는 EntryPoint
 *
 * - 토큰 자체가 없음 → AUTH_REQUIRED
 * - 토큰은 있었는데 서명/만료 검증 실패 → ACCESS_INVALID (JwtAuthenticationFilter 가 표시해 둔 경우)
 */
@RequiredArgsConstructor
public class RestAuthEntryPoint implements AuthenticationEntryPoint {

    private final SecurityErrorWriter errorWriter;

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException) throws IOException {

        boolean invalidToken = Boolean.TRUE.equals(request.getAttribute(JwtAuthenticationFilter.ACCESS_INVALID_ATTRIBUTE));
        errorWriter.write(response, invalidToken ? ErrorCode.ACCESS_INVALID : ErrorCode.AUTH_REQUIRED);
    }
}
