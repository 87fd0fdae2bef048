package com.cryptosignal.collector.ratelimit;

/**
 * @param limit             per-minute limit of the caller's tier
 * @param remaining         remaining requests in the more restrictive window
 * @param resetAt           epoch seconds at which the oldest minute-window entry expires
 * @param retryAfterSeconds 0 when allowed
 * @param failOpen          true when the store was unreachable and the request was let through
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        long remaining,
        long resetAt,
        long retryAfterSeconds,
        boolean failOpen
) {
}
