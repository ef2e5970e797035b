package com.redisui.backend.auth.token.support;

import java.util.List;

/**
 * 인증 쿠키 이름
 *
 * 현재 이름(rds_*)만 쓰고, 예전 이름 3개는 읽기 전용으로 남겨둔다.
 * - access 읽기 순서: rds_access_token → access_token → token
 * - refresh 읽기 순서: rds_refresh_token → refresh_token
 * - 로그인/리프레시/로그아웃 때 예전 이름은 항상 삭제 쿠키를 내려준다
 */
public final class AuthCookieNames {
    private AuthCookieNames() {}

    public static final String ACCESS = "rds_access_token";
    public static final String REFRESH = "rds_refresh_token";

    public static final String LEGACY_ACCESS = "access_token";
    public static final String LEGACY_REFRESH = "refresh_token";
    public static final String LEGACY_TOKEN = "token";

    public static final List<String> ACCESS_READ_ORDER = List.of(ACCESS, LEGACY_ACCESS, LEGACY_TOKEN);
    public static final List<String> REFRESH_READ_ORDER = List.of(REFRESH, LEGACY_REFRESH);
    public static final List<String> LEGACY = List.of(LEGACY_ACCESS, LEGACY_REFRESH, LEGACY_TOKEN);
    public static final List<String> ALL = List.of(ACCESS, REFRESH, LEGACY_ACCESS, LEGACY_REFRESH, LEGACY_TOKEN);
}
