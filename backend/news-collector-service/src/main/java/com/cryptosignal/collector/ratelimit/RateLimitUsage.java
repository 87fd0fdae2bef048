package com.cryptosignal.collector.ratelimit;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 식별자별 현재 사용량. 일일 한도가 무제한이면 dayLimit, dayRemaining 은 -1.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateLimitUsage(
        String identifier,
        String tier,
        long requestsThisMinute,
        int limitPerMinute,
        long remainingThisMinute,
        long requestsToday,
        int limitPerDay,
        long remainingToday,
        Boolean storeUnavailable
) {
}
