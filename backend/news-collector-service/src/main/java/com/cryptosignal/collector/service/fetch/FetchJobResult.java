package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.FetchableSource;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one source in one fetch cycle. {@code error} is null on success; articles is empty on failure.
 */
public record FetchJobResult(
        Long sourceId,
        String sourceKey,
        List<Article> articles,
        Duration fetchTime,
        Throwable error,
        int retryCount
) {

    public FetchJobResult {
        articles = articles != null ? articles : List.of();
    }

    public static FetchJobResult success(FetchableSource source, List<Article> articles,
                                         Duration fetchTime, int retryCount) {
        return new FetchJobResult(source.getId(), source.getKey(), articles, fetchTime, null, retryCount);
    }

    public static FetchJobResult failure(FetchableSource source, Throwable error,
                                         Duration fetchTime, int retryCount) {
        return new FetchJobResult(source.getId(), source.getKey(), List.of(), fetchTime, error, retryCount);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
