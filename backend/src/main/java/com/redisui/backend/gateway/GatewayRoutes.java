package com.redisui.backend.gateway;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.redisui.backend.auth.config.AuthProperties;

/**
 * 페이지 경로 분류기
 *
 * - PUBLIC: 게이트웨이가 손대지 않음 (/api, /_next, 정적 파일)
 * - AUTH_ONLY: 로그인 전용 페이지 (/login). PROTECTED 보다 먼저 본다
 * - PROTECTED: 로그인이 필요한 페이지. "/" 는 정확히 일치할 때만, 나머지는 경로 세그먼트 단위 prefix
 * - OTHER: 그 외 (그냥 통과)
 */
public class GatewayRoutes {

    public enum RouteType { PUBLIC, AUTH_ONLY, PROTECTED, OTHER }

    private static final Set<String> STATIC_EXTENSIONS = Set.of(
            "js", "css", "map", "png", "jpg", "jpeg", "gif", "svg", "ico", "webp",
            "woff", "woff2", "ttf", "eot", "txt", "json", "xml");

    private final List<String> publicPrefixes;
    private final List<String> protectedRoutes;
    private final List<String> authRoutes;

    public GatewayRoutes(AuthProperties.Gateway props) {
        this.publicPrefixes = props.publicPrefixes();
        this.protectedRoutes = props.protectedRoutes();
        this.authRoutes = props.authRoutes();
    }

    public RouteType classify(String rawPath) {
        String path = (rawPath == null || rawPath.isEmpty()) ? "/" : rawPath;

        if (isPublic(path)) return RouteType.PUBLIC;
        if (authRoutes.stream().anyMatch(route -> matches(route, path))) return RouteType.AUTH_ONLY;
        if (protectedRoutes.stream().anyMatch(route -> matches(route, path))) return RouteType.PROTECTED;
        return RouteType.OTHER;
    }

    private boolean isPublic(String path) {
        for (String prefix : publicPrefixes) {
            if (path.equals(prefix) || path.startsWith(prefix.endsWith("/") ? prefix : prefix + "/")) {
                return true;
            }
        }
        return isStaticAsset(path);
    }

    static boolean isStaticAsset(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot <= slash + 1 || dot == path.length() - 1) return false;
        return STATIC_EXTENSIONS.contains(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    // "/users" 는 "/users", "/users/3" 에 걸리고 "/usersettings" 에는 안 걸린다
    static boolean matches(String route, String path) {
        if ("/".equals(route)) return "/".equals(path);
        return path.equals(route) || path.startsWith(route + "/");
    }
}
