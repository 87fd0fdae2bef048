package com.cryptosignal.collector.service.fetch;

import java.time.Duration;
import java.util.List;

/**
 * Timing figures over the successful jobs of a cycle.
 */
public record FetchStats(
        int totalSources,
        int successfulSources,
        int failedSources,
        int totalArticles,
        int newArticles,
        Duration avgFetchTime,
        Duration minFetchTime,
        Duration maxFetchTime,
        int totalRetries
) {

    public static FetchStats calculate(List<FetchJobResult> results, int newArticles) {
        int successful = 0;
        int articles = 0;
        int retries = 0;
        Duration total = Duration.ZERO;
        Duration min = null;
        Duration max = Duration.ZERO;

        for (FetchJobResult result : results) {
            retries += result.retryCount();
            if (!result.isSuccess()) {
                continue;
            }
            successful++;
            articles += result.articles().size();
            Duration time = result.fetchTime();
            total = total.plus(time);
            if (min == null || time.compareTo(min) < 0) {
                min = time;
            }
            if (time.compareTo(max) > 0) {
                max = time;
            }
        }

        Duration avg = successful > 0 ? total.dividedBy(successful) : Duration.ZERO;
        return new FetchStats(results.size(), successful, results.size() - successful, articles, newArticles,
                avg, min != null ? min : Duration.ZERO, max, retries);
    }
}
