package com.redisui.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청을 보낸 클라이언트 식별 정보 (IP, User-Agent)
 *
 * IP 결정 순서 (trustForwarded=true, 신뢰하는 리버스 프록시 뒤일 때):
 * - X-Forwarded-For 의 첫 번째 값
 * - X-Real-IP
 * - CF-Connecting-IP
 * - 그래도 없으면 소켓의 remoteAddr
 * trustForwarded=false 면 헤더는 무시하고 remoteAddr 만 쓴다
 *
 * 로그인 잠금 키, 세션 레코드, 감사 로그에서 같은 값을 쓴다.
 */
public record ClientInfo(String ip, String userAgent) {

    public static final String UNKNOWN = "unknown";

    private static final int MAX_USER_AGENT = 255;

    public static ClientInfo from(HttpServletRequest request, boolean trustForwarded) {
        String ip = trustForwarded ? resolveForwardedIp(request) : remoteAddr(request);
        return new ClientInfo(ip, truncate(request.getHeader("User-Agent")));
    }

    public static ClientInfo unknown() {
        return new ClientInfo(UNKNOWN, null);
    }

    private static String resolveForwardedIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            String first = forwarded.split(",", 2)[0].trim();
            if (!first.isEmpty()) return first;
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) return realIp.trim();

        String cfIp = request.getHeader("CF-Connecting-IP");
        if (cfIp != null && !cfIp.isBlank()) return cfIp.trim();

        return remoteAddr(request);
    }

    private static String remoteAddr(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        return (remote == null || remote.isBlank()) ? UNKNOWN : remote;
    }

    private static String truncate(String userAgent) {
        if (userAgent == null) return null;
        return userAgent.length() > MAX_USER_AGENT ? userAgent.substring(0, MAX_USER_AGENT) : userAgent;
    }
}
