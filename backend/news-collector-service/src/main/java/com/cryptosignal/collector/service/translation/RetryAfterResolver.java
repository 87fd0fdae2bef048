package com.cryptosignal.collector.service.translation;

import java.time.Duration;
import java.util.Locale;

/**
 * Decides whether a translation failure is a rate limit and how long to back off.
 *
 * <p>Checked in order: an explicit retry-after value, then HTTP 429 (60s), then the error message
 * mentioning "429" or "rate limit" (60s). The message check is a best-effort heuristic for
 * providers that only report the condition in text.
 */
public final class RetryAfterResolver {

    static final Duration DEFAULT_RATE_LIMIT_BACKOFF = Duration.ofSeconds(60);

    private static final int TOO_MANY_REQUESTS = 429;

    private RetryAfterResolver() {
    }

    /**
     * @return backoff duration, or {@link Duration#ZERO} when the failure is not a rate limit
     */
    public static Duration resolve(TranslationFailure failure) {
        if (failure == null) {
            return Duration.ZERO;
        }

        Duration explicit = failure.retryAfter();
        if (explicit != null && !explicit.isNegative() && !explicit.isZero()) {
            return explicit;
        }

        Integer status = failure.statusCode();
        if (status != null && status == TOO_MANY_REQUESTS) {
            return DEFAULT_RATE_LIMIT_BACKOFF;
        }

        String message = failure.message();
        if (message != null) {
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("429") || lower.contains("rate limit")) {
                return DEFAULT_RATE_LIMIT_BACKOFF;
            }
        }
        return Duration.ZERO;
    }
}
