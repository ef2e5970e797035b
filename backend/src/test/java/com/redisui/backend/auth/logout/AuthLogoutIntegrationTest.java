package com.redisui.backend.auth.logout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import com.redisui.backend.auth.AbstractAuthIntegrationTest;
import com.redisui.backend.global.ErrorCode;
import com.redisui.backend.support.AuthFlowSupport;
import com.redisui.backend.support.AuthHttpSupport;
import com.redisui.backend.support.AuthHttpSupport.LoginResult;

@DisplayName("[Auth][Logout] 로그아웃(/api/auth/logout) 통합 테스트")
class AuthLogoutIntegrationTest extends AbstractAuthIntegrationTest {

    @Test
    @DisplayName("로그아웃 → 200 {success:true} + 쿠키 5종 삭제 + 현재 세션 삭제")
    void logout_deletes_current_session_and_clears_cookies() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, ADMIN, PASSWORD, false);

        var res = AuthHttpSupport.performLogout(mvc, login.cookies())
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andReturn();

        AuthHttpSupport.assertClearsAllAuthCookies(res.getResponse().getHeaders(HttpHeaders.SET_COOKIE));
        assertThat(sessionRepository.findByTokenHash(tokenHashUtils.sha256Hex(login.refreshRaw()))).isEmpty();
    }

    @Test
    @DisplayName("로그아웃 후 같은 access 토큰으로 /me → 401 SESSION_EXPIRED (서명은 아직 유효)")
    void access_token_is_dead_after_logout() throws Exception {
        LoginResult login = AuthFlowSupport.loginOk(mvc, EDITOR, PASSWORD, false);
        AuthHttpSupport.performLogout(mvc, login.cookies()).andExpect(status().isOk());

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performMe(mvc, login.accessCookie()),
                ErrorCode.SESSION_EXPIRED);
    }

    @Test
    @DisplayName("다른 기기의 세션은 로그아웃 영향을 받지 않는다")
    void logout_keeps_other_sessions() throws Exception {
        LoginResult laptop = AuthFlowSupport.loginOk(mvc, ADMIN, PASSWORD, false);
        LoginResult phone = AuthFlowSupport.loginOk(mvc, ADMIN, PASSWORD, true);

        AuthHttpSupport.performLogout(mvc, laptop.cookies()).andExpect(status().isOk());

        AuthHttpSupport.performMe(mvc, phone.accessCookie()).andExpect(status().isOk());
        assertThat(sessionRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("인증 없이 로그아웃 → 401 AUTH_REQUIRED")
    void logout_requires_auth() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performLogout(mvc),
                ErrorCode.AUTH_REQUIRED);
    }
}
