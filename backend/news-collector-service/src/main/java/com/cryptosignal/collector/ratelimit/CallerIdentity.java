package com.cryptosignal.collector.ratelimit;

import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청자 식별.
 *
 * 게이트웨이가 인증 후 넣어주는 X-User-Id / X-User-Tier 헤더가 있으면 사용자 기준,
 * 없으면 클라이언트 IP 기준 (anonymous 등급).
 */
public record CallerIdentity(String identifier, RateLimitTier tier) {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_TIER_HEADER = "X-User-Tier";

    public static CallerIdentity from(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId != null && !userId.isBlank()) {
            return new CallerIdentity("user:" + userId.trim(),
                    RateLimitTier.fromValue(request.getHeader(USER_TIER_HEADER)));
        }
        return new CallerIdentity("ip:" + clientIp(request), RateLimitTier.ANONYMOUS);
    }

    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            int comma = forwarded.indexOf(',');
            return (comma >= 0 ? forwarded.substring(0, comma) : forwarded).trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        return request.getRemoteAddr();
    }
}
