package com.redisui.backend.auth.login;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import com.redisui.backend.auth.AbstractAuthIntegrationTest;
import com.redisui.backend.auth.domain.UserRole;
import com.redisui.backend.auth.token.domain.AuthSession;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.support.AuthFlowSupport;
import com.redisui.backend.support.AuthHttpSupport;
import com.redisui.backend.support.AuthHttpSupport.LoginResult;

import jakarta.servlet.http.Cookie;

@DisplayName("[Auth][Login] 로그인(/api/auth/login) 통합 테스트")
class AuthLoginIntegrationTest extends AbstractAuthIntegrationTest {

    @Test
    @DisplayName("로그인 성공 → 200 + 사용자 요약 + access/refresh 쿠키 + DB에는 refresh 해시만 저장")
    void login_success_sets_cookies_and_stores_hash() throws Exception {
        var res = AuthHttpSupport.performLogin(mvc, ADMIN, PASSWORD, false)
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.id").isNumber())
                .andExpect(jsonPath("$.user.username").value(ADMIN))
                .andExpect(jsonPath("$.user.role").value("admin"))
                .andExpect(jsonPath("$.accessExpiresAt").isNotEmpty())
                .andExpect(jsonPath("$.refreshExpiresAt").isNotEmpty())
                .andExpect(jsonPath("$.accessToken").doesNotExist())
                .andReturn();

        LoginResult login = AuthHttpSupport.toResult(res);

        // access: Max-Age = access TTL(900), refresh: Max-Age = 세션 수명(1일)
        AuthHttpSupport.assertAuthCookiePolicy(
                AuthHttpSupport.findSetCookieLine(login.setCookieHeaders(), AuthHttpSupport.ACCESS_COOKIE), 900);
        AuthHttpSupport.assertAuthCookiePolicy(
                AuthHttpSupport.findSetCookieLine(login.setCookieHeaders(), AuthHttpSupport.REFRESH_COOKIE), 86400);
        AuthHttpSupport.assertClearsLegacyCookies(login.setCookieHeaders());

        // DB에는 원문이 아니라 sha256 hex 가 저장된다
        AuthSession saved = sessionRepository.findByTokenHash(tokenHashUtils.sha256Hex(login.refreshRaw())).orElseThrow();
        assertThat(saved.getTokenHash()).hasSize(64).isNotEqualTo(login.refreshRaw());
        assertThat(saved.isRememberMe()).isFalse();
        assertThat(saved.getIpAddress()).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("로그인(remember=true) → refresh Max-Age 30일 + DB rememberMe=true")
    void login_with_remember_uses_long_session() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EDITOR, PASSWORD, true);

        String refreshLine = AuthHttpSupport.findSetCookieLine(login.setCookieHeaders(), AuthHttpSupport.REFRESH_COOKIE);
        AuthHttpSupport.assertAuthCookiePolicy(refreshLine, 2_592_000);

        AuthSession saved = sessionRepository.findByTokenHash(tokenHashUtils.sha256Hex(login.refreshRaw())).orElseThrow();
        assertThat(saved.isRememberMe()).isTrue();
    }

    @Test
    @DisplayName("로그인 실패: 비밀번호 불일치 → 401 INVALID_CREDENTIALS")
    void login_wrong_password_returns_401() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, ADMIN, "WrongPass1!", false),
                ErrorCode.INVALID_CREDENTIALS);

        assertThat(sessionRepository.count()).isZero();
    }

    @Test
    @DisplayName("로그인 실패: 존재하지 않는 아이디 → 401 INVALID_CREDENTIALS (사유 구분 없음)")
    void login_unknown_user_returns_same_error() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, "ghost", PASSWORD, false),
                ErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("로그인: 아이디는 대소문자를 구분한다")
    void login_username_is_case_sensitive() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, "ADMIN", PASSWORD, false),
                ErrorCode.INVALID_CREDENTIALS);
    }

    @Test
    @DisplayName("로그인 실패 5회 → 5번째에서 423 ACCOUNT_LOCKED + Retry-After, 이후 올바른 비밀번호도 423")
    void fifth_failure_locks_account() throws Exception {
        for (int i = 0; i < 4; i++) {
            AuthHttpSupport.expectErrorWithCode(
                    AuthHttpSupport.performLogin(mvc, VIEWER, "WrongPass1!", false),
                    ErrorCode.INVALID_CREDENTIALS);
        }

        AuthHttpSupport.expectErrorWithCode(
                        AuthHttpSupport.performLogin(mvc, VIEWER, "WrongPass1!", false),
                        ErrorCode.ACCOUNT_LOCKED)
                .andExpect(jsonPath("$.retryAfterSeconds").value(900))
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "900"))
                .andExpect(jsonPath("$.message").value(containsString("15분")));

        // 잠금 중에는 비밀번호가 맞아도 거부
        AuthHttpSupport.expectErrorWithCode(
                        AuthHttpSupport.performLogin(mvc, VIEWER, PASSWORD, false),
                        ErrorCode.ACCOUNT_LOCKED)
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER));

        assertThat(sessionRepository.count()).isZero();
    }

    @Test
    @DisplayName("잠금 키는 소문자 username 기준: 대소문자만 다른 시도도 같은 카운트로 누적")
    void lock_key_is_case_insensitive() throws Exception {
        for (String name : new String[] { "viewer", "Viewer", "VIEWER", "vIewer" }) {
            AuthHttpSupport.performLogin(mvc, name, "WrongPass1!", false).andExpect(status().isUnauthorized());
        }

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, "viEWer", "WrongPass1!", false),
                ErrorCode.ACCOUNT_LOCKED);
    }

    @Test
    @DisplayName("로그인 성공 시 실패 카운트 초기화")
    void success_clears_failure_count() throws Exception {
        for (int i = 0; i < 4; i++) {
            AuthHttpSupport.performLogin(mvc, EDITOR, "WrongPass1!", false).andExpect(status().isUnauthorized());
        }
        AuthFlowSupport.loginOk(mvc, EDITOR, PASSWORD, false);

        // 다시 4번 틀려도 잠기지 않는다
        for (int i = 0; i < 4; i++) {
            AuthHttpSupport.expectErrorWithCode(
                    AuthHttpSupport.performLogin(mvc, EDITOR, "WrongPass1!", false),
                    ErrorCode.INVALID_CREDENTIALS);
        }
    }

    @Test
    @DisplayName("X-Forwarded-For 를 매번 바꿔 보내도 같은 잠금 키로 센다 (기본 설정은 전달 헤더 미신뢰)")
    void forwarded_header_rotation_does_not_escape_lockout() throws Exception {
        for (int i = 1; i <= 5; i++) {
            mvc.perform(post("/api/auth/login")
                    .header("X-Forwarded-For", "198.51.100." + i)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                            {"username":"%s","password":"Wr0ngPass!"}
                            """.formatted(VIEWER)));
        }

        mvc.perform(post("/api/auth/login")
                        .header("X-Forwarded-For", "198.51.100.99")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"%s","password":"%s"}
                                """.formatted(VIEWER, PASSWORD)))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.code").value(ErrorCode.ACCOUNT_LOCKED.name()));
    }

    @Test
    @DisplayName("비활성 계정 → 403 ACCOUNT_DISABLED, 세션 생성 안 함")
    void inactive_user_is_rejected() throws Exception {
        seedUser("sleeper", UserRole.VIEWER, false);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, "sleeper", PASSWORD, false),
                ErrorCode.ACCOUNT_DISABLED);

        assertThat(sessionRepository.count()).isZero();
    }

    @Test
    @DisplayName("요청 검증 실패: username 공백 → 400 VALIDATION_ERROR")
    void blank_username_is_validation_error() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogin(mvc, "   ", PASSWORD, false),
                ErrorCode.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("오래된/깨진 access 쿠키가 있어도 로그인은 막히지 않는다")
    void stale_access_cookie_does_not_block_login() throws Exception {
        mvc.perform(post("/api/auth/login")
                        .cookie(new Cookie(AuthHttpSupport.ACCESS_COOKIE, "garbage.token.value"))
                        .contentType("application/json")
                        .content("""
                                {"username":"%s","password":"%s"}
                                """.formatted(ADMIN, PASSWORD)))
                .andExpect(status().isOk());
    }
}
