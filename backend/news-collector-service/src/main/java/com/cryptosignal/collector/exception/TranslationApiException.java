package com.cryptosignal.collector.exception;

import java.time.Duration;

/**
 * Non-2xx reply from the translation API, with the status and Retry-After hint when present.
 */
public class TranslationApiException extends CollectorException {

    private final int statusCode;
    private final Duration retryAfter;

    public TranslationApiException(int statusCode, String message, Duration retryAfter) {
        super("TRANSLATION_API_ERROR", message);
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
