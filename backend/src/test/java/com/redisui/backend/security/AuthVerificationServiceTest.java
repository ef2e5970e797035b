package com.redisui.backend.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;

import com.redisui.backend.auth.config.AuthProperties;
import com.redisui.backend.auth.domain.User;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.token.domain.AuthSession;
import com.redisui.backend.auth.token.domain.LiveSession;
import com.redisui.backend.auth.token.service.AuthSessionService;
import com.redisui.backend.auth.token.support.AuthCookieUtils;
import com.redisui.backend.global.ApiException;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.support.MutableClock;
import com.redisui.backend.support.TestAuthProperties;

import jakarta.servlet.http.Cookie;

@DisplayName("[Security][Verify] AuthVerificationService 단위 테스트")
class AuthVerificationServiceTest {

    private JwtService jwtService;
    private AuthSessionService sessionService;
    private AuthVerificationService verificationService;

    @BeforeEach
    void setUp() {
        AuthProperties props = TestAuthProperties.defaults();
        jwtService = new JwtService(props, new MutableClock(Instant.now()));
        sessionService = mock(AuthSessionService.class);
        verificationService = new AuthVerificationService(
                jwtService, sessionService, new AccessTokenExtractor(new AuthCookieUtils(props)));
    }

    @Test
    @DisplayName("토큰 없음 → AUTH_REQUIRED, 세션 조회 안 함")
    void no_token() {
        assertError(() -> verificationService.requireAuth(new MockHttpServletRequest()), ErrorCode.AUTH_REQUIRED);
        verify(sessionService, never()).validateSession(anyLong(), anyLong());
    }

    @Test
    @DisplayName("서명 불량 → ACCESS_INVALID")
    void bad_signature() {
        assertError(() -> verificationService.requireAuth(requestWithCookie("broken.jwt.value")), ErrorCode.ACCESS_INVALID);
    }

    @Test
    @DisplayName("서명은 유효하지만 세션이 없음 → SESSION_EXPIRED")
    void session_gone() {
        String token = jwtService.issueAccessToken(1L, "alice", UserRole.ADMIN, 10L).token();
        when(sessionService.validateSession(10L, 1L)).thenReturn(Optional.empty());

        assertError(() -> verificationService.requireAuth(requestWithCookie(token)), ErrorCode.SESSION_EXPIRED);
        assertThat(verificationService.verify(requestWithCookie(token))).isEmpty();
    }

    @Test
    @DisplayName("살아있는 세션 → principal 의 username/role 은 DB 값")
    void principal_comes_from_db() {
        String token = jwtService.issueAccessToken(1L, "old-name", UserRole.VIEWER, 10L).token();
        liveSession(1L, "alice", UserRole.EDITOR, 10L);

        AuthPrincipal principal = verificationService.requireAuth(requestWithCookie(token));

        assertThat(principal.userId()).isEqualTo(1L);
        assertThat(principal.username()).isEqualTo("alice");
        assertThat(principal.role()).isEqualTo(UserRole.EDITOR);
        assertThat(principal.sessionId()).isEqualTo(10L);
    }

    @Test
    @DisplayName("Bearer 헤더가 쿠키보다 우선")
    void bearer_wins_over_cookie() {
        String token = jwtService.issueAccessToken(2L, "bob", UserRole.VIEWER, 20L).token();
        liveSession(2L, "bob", UserRole.VIEWER, 20L);

        MockHttpServletRequest req = requestWithCookie("garbage");
        req.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token);

        assertThat(verificationService.requireAuth(req).username()).isEqualTo("bob");
    }

    @Test
    @DisplayName("requireRole: 계층 검사 (admin 은 editor 요구 통과, viewer 는 403)")
    void require_role_is_hierarchical() {
        String adminToken = jwtService.issueAccessToken(1L, "root", UserRole.ADMIN, 1L).token();
        liveSession(1L, "root", UserRole.ADMIN, 1L);
        String viewerToken = jwtService.issueAccessToken(2L, "guest", UserRole.VIEWER, 2L).token();
        liveSession(2L, "guest", UserRole.VIEWER, 2L);

        assertThat(verificationService.requireRole(requestWithCookie(adminToken), UserRole.EDITOR).role())
                .isEqualTo(UserRole.ADMIN);
        assertError(() -> verificationService.requireRole(requestWithCookie(viewerToken), UserRole.EDITOR),
                ErrorCode.FORBIDDEN);
    }

    @Test
    @DisplayName("requireAnyRole: 나열된 권한과 정확히 일치해야 통과 (계층 무시)")
    void require_any_role_is_exact() {
        String adminToken = jwtService.issueAccessToken(1L, "root", UserRole.ADMIN, 1L).token();
        liveSession(1L, "root", UserRole.ADMIN, 1L);
        String editorToken = jwtService.issueAccessToken(3L, "ed", UserRole.EDITOR, 3L).token();
        liveSession(3L, "ed", UserRole.EDITOR, 3L);

        assertError(() -> verificationService.requireAnyRole(requestWithCookie(adminToken), UserRole.EDITOR, UserRole.VIEWER),
                ErrorCode.FORBIDDEN);
        assertThat(verificationService.requireAnyRole(requestWithCookie(editorToken), UserRole.EDITOR, UserRole.VIEWER)
                .username()).isEqualTo("ed");
    }

    private void liveSession(Long userId, String username, UserRole role, Long sessionId) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(userId);
        when(user.getUsername()).thenReturn(username);
        when(user.getRole()).thenReturn(role);
        when(sessionService.validateSession(sessionId, userId))
                .thenReturn(Optional.of(new LiveSession(mock(AuthSession.class), user)));
    }

    private static MockHttpServletRequest requestWithCookie(String token) {
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.setCookies(new Cookie("rds_access_token", token));
        return req;
    }

    private static void assertError(ThrowingCallable call, ErrorCode expected) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.getErrorCode()).isEqualTo(expected));
    }
}
