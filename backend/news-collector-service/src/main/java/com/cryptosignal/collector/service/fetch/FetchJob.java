package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.FetchableSource;

public record FetchJob(FetchableSource source, SourceFetcher fetcher) {
}
