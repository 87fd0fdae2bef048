package com.cryptosignal.collector.service.fetch;

import java.time.Duration;
import java.util.List;

/**
 * Totals of one fetch cycle. {@code errors} holds every failed source.
 */
public record FetchResult(
        int totalSources,
        int successfulFeeds,
        int failedFeeds,
        int totalArticles,
        int newArticles,
        Duration duration,
        List<FetchError> errors
) {

    public FetchResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static FetchResult empty(Duration duration) {
        return new FetchResult(0, 0, 0, 0, 0, duration, List.of());
    }
}
