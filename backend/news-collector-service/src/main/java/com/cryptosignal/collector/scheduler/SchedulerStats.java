package com.cryptosignal.collector.scheduler;

import java.time.Duration;
import java.time.Instant;

public record SchedulerStats(
        boolean running,
        Duration interval,
        Instant lastFetch,
        long fetchCount,
        long errorCount,
        int lastSuccessfulFeeds,
        int lastFailedFeeds,
        int lastNewArticles,
        Duration lastDuration,
        Duration nextFetchIn
) {
}
