package com.cryptosignal.collector.service.translation;

import com.cryptosignal.collector.config.TranslationProperties;
import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.TranslationStatus;
import com.cryptosignal.collector.service.ArticleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 번역 대기 기사를 주기적으로 번역하는 백그라운드 워커.
 *
 * 한 배치는 PENDING 우선, 그다음 FAILED 순으로 최대 batchSize 건을 순차 처리한다.
 * 번역기가 요청 제한을 보고하면 남은 배치를 즉시 중단하고 retry-after 시각까지 모든 틱을 건너뛴다.
 */
@Component
@Slf4j
public class TranslationWorker {

    private final ArticleService articleService;
    private final ArticleTranslator translator;
    private final TranslationProperties properties;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private Thread workerThread;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile Instant backoffUntil;
    private final AtomicLong batchesProcessed = new AtomicLong();
    private final AtomicLong translatedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public TranslationWorker(ArticleService articleService, ArticleTranslator translator,
                             TranslationProperties properties, Clock clock) {
        this.articleService = articleService;
        this.translator = translator;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Starts the loop on its own thread. A second call while running does nothing.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (workerThread != null && workerThread.isAlive()) {
                log.info("Translation worker already running");
                return;
            }
            CountDownLatch signal = new CountDownLatch(1);
            stopSignal = signal;
            workerThread = new Thread(() -> runLoop(signal), "translation-worker");
            workerThread.setDaemon(true);
            workerThread.start();
        }
        log.info("Translation worker started (interval={}, batchSize={})",
                properties.getInterval(), properties.getBatchSize());
    }

    /**
     * Signals the loop and waits until it has exited. An article update in progress completes first.
     */
    public void stop() {
        Thread thread;
        synchronized (lifecycleLock) {
            thread = workerThread;
            if (thread == null) {
                return;
            }
            workerThread = null;
        }

        log.info("Stopping translation worker...");
        stopSignal.countDown();
        try {
            thread.join();
            log.info("Translation worker stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for translation worker to stop");
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return workerThread != null && workerThread.isAlive();
        }
    }

    private void runLoop(CountDownLatch signal) {
        processBatch();
        try {
            while (!signal.await(properties.getInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                processBatch();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One tick: skipped entirely while inside a rate-limit backoff window.
     */
    void processBatch() {
        Instant now = clock.instant();
        Instant until = backoffUntil;
        if (until != null) {
            if (now.isBefore(until)) {
                log.debug("Rate limited, {}s left before retrying translations",
                        Duration.between(now, until).toSeconds());
                return;
            }
            log.info("Rate limit backoff ended, resuming translations");
            backoffUntil = null;
        }

        List<Article> articles;
        try {
            articles = articleService.getPendingTranslations(properties.getBatchSize());
        } catch (RuntimeException e) {
            log.error("Error fetching pending translations: {}", e.getMessage(), e);
            return;
        }
        if (articles.isEmpty()) {
            return;
        }

        log.info("Processing {} articles for translation", articles.size());
        batchesProcessed.incrementAndGet();

        int translated = 0;
        int failed = 0;
        for (int i = 0; i < articles.size(); i++) {
            if (i > 0 && !pause()) {
                return;
            }
            if (stopRequested()) {
                return;
            }

            Article article = articles.get(i);
            TranslationOutcome outcome = translate(article);
            if (outcome.isSuccess() && saveTranslation(article, outcome)) {
                translated++;
                continue;
            }

            failed++;
            TranslationFailure failure = outcome.isSuccess()
                    ? TranslationFailure.of("Could not store translation")
                    : outcome.failure();
            log.warn("Failed to translate article {}: {}", article.getId(), failure.message());
            markFailed(article);

            Duration retryAfter = RetryAfterResolver.resolve(failure);
            if (!retryAfter.isZero()) {
                backoffUntil = clock.instant().plus(retryAfter);
                log.warn("Translation rate limit hit, pausing for {}s and dropping the rest of the batch",
                        retryAfter.toSeconds());
                break;
            }
        }

        translatedCount.addAndGet(translated);
        failedCount.addAndGet(failed);
        log.info("Translation batch complete: {} translated, {} failed", translated, failed);
    }

    private TranslationOutcome translate(Article article) {
        String title = article.getOriginalTitle() != null ? article.getOriginalTitle() : article.getTitle();
        String description = article.getOriginalDescription() != null
                ? article.getOriginalDescription() : article.getDescription();
        try {
            return translator.translate(title, description, article.getOriginalLanguage());
        } catch (RuntimeException e) {
            return TranslationOutcome.failure(TranslationFailure.of(e.getMessage()));
        }
    }

    private boolean saveTranslation(Article article, TranslationOutcome outcome) {
        try {
            articleService.updateTranslation(article.getId(), outcome.title(), outcome.description(),
                    TranslationStatus.COMPLETED);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to store translation for article {}: {}", article.getId(), e.getMessage());
            return false;
        }
    }

    private void markFailed(Article article) {
        try {
            articleService.updateTranslation(article.getId(), article.getTitle(), article.getDescription(),
                    TranslationStatus.FAILED);
        } catch (RuntimeException e) {
            log.error("Failed to mark article {} as failed: {}", article.getId(), e.getMessage());
        }
    }

    /**
     * @return false when stop was requested during the pause
     */
    private boolean pause() {
        Duration pacing = properties.getPacing();
        if (pacing == null || pacing.isZero() || pacing.isNegative()) {
            return !stopRequested();
        }
        try {
            return !stopSignal.await(pacing.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0 || Thread.currentThread().isInterrupted();
    }

    public Instant getBackoffUntil() {
        return backoffUntil;
    }

    public TranslationWorkerStats getStats() {
        return new TranslationWorkerStats(isRunning(), backoffUntil, batchesProcessed.get(),
                translatedCount.get(), failedCount.get());
    }
}
