package com.cryptosignal.collector.ratelimit;

import java.util.Locale;

public enum RateLimitTier {
    ANONYMOUS("anonymous"),
    FREE("free"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String value;

    RateLimitTier(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Unknown or missing tiers are treated as anonymous.
     */
    public static RateLimitTier fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ANONYMOUS;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RateLimitTier tier : values()) {
            if (tier.value.equals(normalized)) {
                return tier;
            }
        }
        return ANONYMOUS;
    }
}
