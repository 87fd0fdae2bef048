package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.FetchableSource;

import java.time.Duration;
import java.util.List;

/**
 * Fetches and converts one source's feed. Implementations must honour the timeout and
 * respond to thread interruption.
 */
@FunctionalInterface
public interface SourceFetcher {

    List<Article> fetch(FetchableSource source, Duration timeout) throws InterruptedException;
}
