package com.cryptosignal.collector.service.translation;

import java.time.Duration;

/**
 * Why a translation failed. statusCode and retryAfter are null when the cause carried none.
 */
public record TranslationFailure(String message, Integer statusCode, Duration retryAfter) {

    public static TranslationFailure of(String message) {
        return new TranslationFailure(message, null, null);
    }
}
