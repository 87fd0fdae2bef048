package com.cryptosignal.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 요청 제한 설정 (collector.rate-limit.*)
 *
 * tiers 키는 anonymous / free / pro / enterprise 이며, requests-per-day 가 -1 이면 무제한.
 */
@ConfigurationProperties(prefix = "collector.rate-limit")
@Data
public class RateLimitProperties {

    private boolean enabled = true;

    /**
     * Counter store backing the sliding windows: "redis" or "memory"
     */
    private String store = "redis";

    private Map<String, TierLimit> tiers = new LinkedHashMap<>();

    @Data
    public static class TierLimit {
        private int requestsPerMinute;
        private int requestsPerDay;

        public TierLimit() {
        }

        public TierLimit(int requestsPerMinute, int requestsPerDay) {
            this.requestsPerMinute = requestsPerMinute;
            this.requestsPerDay = requestsPerDay;
        }

        public boolean isDailyUnlimited() {
            return requestsPerDay < 0;
        }
    }
}
