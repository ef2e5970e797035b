package com.redisui.backend.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.redisui.backend.gateway.GatewayRoutes.RouteType;
import com.redisui.backend.support.TestAuthProperties;

@DisplayName("[Gateway] 경로 분류 테스트")
class GatewayRoutesTest {

    private final GatewayRoutes routes = new GatewayRoutes(TestAuthProperties.defaults().gateway());

    @Test
    @DisplayName("/api, /_next, 정적 파일은 PUBLIC")
    void public_paths() {
        assertThat(routes.classify("/api/auth/login")).isEqualTo(RouteType.PUBLIC);
        assertThat(routes.classify("/api")).isEqualTo(RouteType.PUBLIC);
        assertThat(routes.classify("/_next/static/chunk.js")).isEqualTo(RouteType.PUBLIC);
        assertThat(routes.classify("/favicon.ico")).isEqualTo(RouteType.PUBLIC);
        assertThat(routes.classify("/logo.png")).isEqualTo(RouteType.PUBLIC);
        assertThat(routes.classify("/users/avatar.SVG")).isEqualTo(RouteType.PUBLIC);
    }

    @Test
    @DisplayName("\"/\" 는 정확히 일치할 때만 PROTECTED")
    void root_is_exact() {
        assertThat(routes.classify("/")).isEqualTo(RouteType.PROTECTED);
        assertThat(routes.classify("")).isEqualTo(RouteType.PROTECTED);
        assertThat(routes.classify("/about")).isEqualTo(RouteType.OTHER);
    }

    @Test
    @DisplayName("나머지 보호 경로는 세그먼트 단위 prefix")
    void protected_prefixes_match_by_segment() {
        assertThat(routes.classify("/connections")).isEqualTo(RouteType.PROTECTED);
        assertThat(routes.classify("/connections/3/keys")).isEqualTo(RouteType.PROTECTED);
        assertThat(routes.classify("/users")).isEqualTo(RouteType.PROTECTED);
        assertThat(routes.classify("/usersettings")).isEqualTo(RouteType.OTHER);
        assertThat(routes.classify("/apiary")).isEqualTo(RouteType.OTHER);
    }

    @Test
    @DisplayName("/login 은 AUTH_ONLY")
    void login_is_auth_only() {
        assertThat(routes.classify("/login")).isEqualTo(RouteType.AUTH_ONLY);
        assertThat(routes.classify("/login/sso")).isEqualTo(RouteType.AUTH_ONLY);
    }
}
