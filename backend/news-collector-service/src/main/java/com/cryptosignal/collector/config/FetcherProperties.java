package com.cryptosignal.collector.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 피드 수집 파이프라인 설정 (collector.fetcher.*)
 */
@ConfigurationProperties(prefix = "collector.fetcher")
@Validated
@Data
public class FetcherProperties {

    /**
     * Start the periodic fetch scheduler on application startup
     */
    private boolean enabled = true;

    /**
     * Maximum number of feeds fetched at the same time
     */
    @Min(1)
    private int workers = 50;

    /**
     * Per-source fetch timeout, shared by all retry attempts of one job
     */
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);

    @Min(0)
    private int maxRetries = 2;

    /**
     * Base backoff between retries; attempt N waits N * retryBackoff
     */
    private Duration retryBackoff = Duration.ofMillis(500);

    /**
     * Items published before now - maxArticleAge are dropped
     */
    private Duration maxArticleAge = Duration.ofDays(7);

    @NotNull
    private Duration interval = Duration.ofMinutes(3);

    /**
     * How long stop() waits for the scheduler loop to exit before giving up
     */
    @NotNull
    private Duration stopGracePeriod = Duration.ofSeconds(30);

    private String userAgent = "CryptoSignalNews/1.0";
}
