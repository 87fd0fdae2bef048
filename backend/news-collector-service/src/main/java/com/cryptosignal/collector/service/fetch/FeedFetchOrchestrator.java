package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.config.FetcherProperties;
import com.cryptosignal.collector.config.GroqProperties;
import com.cryptosignal.collector.config.TranslationProperties;
import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.FetchableSource;
import com.cryptosignal.collector.entity.NewsSource;
import com.cryptosignal.collector.service.ArticleService;
import com.cryptosignal.collector.service.NewsSourceService;
import com.cryptosignal.collector.service.feed.FeedItem;
import com.cryptosignal.collector.service.feed.HtmlCleaner;
import com.cryptosignal.collector.service.feed.RssFeedService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 활성 소스 전체를 한 번 수집하는 파이프라인.
 *
 * 소스 조회 → 정상 소스 필터 → 워커 풀 수집 → GUID 중복 제거 → 일괄 저장 → 소스 상태 갱신.
 * 개별 소스 실패는 주기 전체를 중단시키지 않으며, 소스 목록 조회 실패만 예외로 전파된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedFetchOrchestrator {

    private static final int LOGGED_ERROR_LIMIT = 5;

    private final NewsSourceService newsSourceService;
    private final ArticleService articleService;
    private final RssFeedService rssFeedService;
    private final HtmlCleaner htmlCleaner;
    private final ArticleEnricher articleEnricher;
    private final FetchWorkerPool fetchWorkerPool;
    private final FetcherProperties fetcherProperties;
    private final TranslationProperties translationProperties;
    private final GroqProperties groqProperties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final BatchProcessor batchProcessor = new BatchProcessor();

    /**
     * @throws com.cryptosignal.collector.exception.SourceListingException if sources cannot be listed
     */
    public FetchResult fetchAllEnabledSources() {
        long startedAt = System.nanoTime();

        List<NewsSource> sources = newsSourceService.listEnabledSources();
        if (sources.isEmpty()) {
            log.info("No enabled sources found");
            return FetchResult.empty(elapsedSince(startedAt));
        }

        log.info("Starting fetch for {} sources", sources.size());

        List<FetchJob> jobs = new ArrayList<>(sources.size());
        for (NewsSource source : sources) {
            if (source.isHealthy()) {
                jobs.add(new FetchJob(source, this::fetchSource));
            } else {
                log.warn("Skipping unhealthy source: {} (errors={})", source.getKey(), source.getErrorCount());
            }
        }

        List<FetchJobResult> results = fetchWorkerPool.processJobs(jobs, fetcherProperties.getTimeout());

        BatchProcessor.Collected collected = batchProcessor.collect(results);
        List<Article> unique = batchProcessor.deduplicate(collected.articles());

        int inserted = 0;
        try {
            inserted = articleService.bulkInsertArticles(unique);
        } catch (RuntimeException e) {
            log.error("Error inserting articles: {}", e.getMessage(), e);
        }

        updateSourceHealth(results);

        List<FetchError> errors = collected.failures().stream().map(FetchError::from).toList();
        FetchResult result = new FetchResult(
                sources.size(),
                results.size() - errors.size(),
                errors.size(),
                collected.articles().size(),
                inserted,
                elapsedSince(startedAt),
                errors);

        logResult(result);
        logStats(FetchStats.calculate(results, inserted));
        recordMetrics(result);
        return result;
    }

    /**
     * Fetches one source and turns its fresh items into enriched, unsaved articles.
     */
    public List<Article> fetchSource(FetchableSource source, Duration timeout) throws InterruptedException {
        List<FeedItem> items = rssFeedService.fetchAndParse(source.getRssUrl(), timeout);
        return toArticles(source, items);
    }

    List<Article> toArticles(FetchableSource source, List<FeedItem> items) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(fetcherProperties.getMaxArticleAge());
        String sourceLanguage = source.getLanguage() == null ? "" : source.getLanguage().toLowerCase(Locale.ROOT);
        boolean needsTranslation = needsTranslation(sourceLanguage);

        List<Article> articles = new ArrayList<>(items.size());
        for (FeedItem item : items) {
            if (item.publishedAt().isBefore(cutoff)) {
                continue;
            }

            Article article = Article.builder()
                    .sourceId(source.getId())
                    .guid(item.guid())
                    .title(htmlCleaner.sanitizeForStorage(item.title(), HtmlCleaner.MAX_TITLE_LENGTH))
                    .link(item.link())
                    .description(htmlCleaner.sanitizeForStorage(item.bestDescription(), HtmlCleaner.MAX_DESCRIPTION_LENGTH))
                    .pubDate(item.publishedAt())
                    .createdAt(now)
                    .build();
            article.setCategories(item.categories());

            if (needsTranslation) {
                article.markForTranslation(sourceLanguage);
            }

            articleEnricher.enrich(article, source.getCategory());
            articles.add(article);
        }
        return articles;
    }

    /**
     * 번역 워커가 실제로 동작할 수 있을 때만 PENDING 으로 표시한다 (API 키 미설정 시 NONE).
     */
    private boolean needsTranslation(String sourceLanguage) {
        String target = translationProperties.getTargetLanguage();
        return translationProperties.isEnabled()
                && groqProperties.isConfigured()
                && target != null && !target.isBlank()
                && !sourceLanguage.isEmpty()
                && !sourceLanguage.equals(target.toLowerCase(Locale.ROOT));
    }

    private void updateSourceHealth(List<FetchJobResult> results) {
        for (FetchJobResult result : results) {
            if (result.isSuccess()) {
                try {
                    newsSourceService.resetErrorCount(result.sourceId());
                } catch (RuntimeException e) {
                    log.warn("Failed to reset error count for {}: {}", result.sourceKey(), e.getMessage());
                }
                try {
                    newsSourceService.updateLastFetch(result.sourceId(), clock.instant());
                } catch (RuntimeException e) {
                    log.warn("Failed to update last fetch for {}: {}", result.sourceKey(), e.getMessage());
                }
            } else {
                try {
                    newsSourceService.incrementErrorCount(result.sourceId());
                } catch (RuntimeException e) {
                    log.warn("Failed to increment error count for {}: {}", result.sourceKey(), e.getMessage());
                }
            }
        }
    }

    private void recordMetrics(FetchResult result) {
        meterRegistry.counter("collector.fetch.cycles").increment();
        meterRegistry.counter("collector.fetch.sources", "outcome", "success").increment(result.successfulFeeds());
        meterRegistry.counter("collector.fetch.sources", "outcome", "failure").increment(result.failedFeeds());
        meterRegistry.counter("collector.fetch.articles.inserted").increment(result.newArticles());
    }

    private void logResult(FetchResult result) {
        log.info("Fetch completed in {}ms: {} sources, {} articles fetched, {} new",
                result.duration().toMillis(), result.totalSources(), result.totalArticles(), result.newArticles());

        List<FetchError> errors = result.errors();
        if (errors.isEmpty()) {
            return;
        }
        log.warn("{} sources failed:", errors.size());
        errors.stream().limit(LOGGED_ERROR_LIMIT)
                .forEach(error -> log.warn("  - {}: {}", error.sourceKey(), error.message()));
        if (errors.size() > LOGGED_ERROR_LIMIT) {
            log.warn("  ... and {} more", errors.size() - LOGGED_ERROR_LIMIT);
        }
    }

    private void logStats(FetchStats stats) {
        log.info("Fetch stats: {}/{} sources ok, avg={}ms min={}ms max={}ms, retries={}",
                stats.successfulSources(), stats.totalSources(),
                stats.avgFetchTime().toMillis(), stats.minFetchTime().toMillis(),
                stats.maxFetchTime().toMillis(), stats.totalRetries());
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
