package com.cryptosignal.collector.scheduler;

import com.cryptosignal.collector.config.FetcherProperties;
import com.cryptosignal.collector.config.GroqProperties;
import com.cryptosignal.collector.config.TranslationProperties;
import com.cryptosignal.collector.service.translation.TranslationWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 기동 완료 후 피드 수집 스케줄러와 번역 워커를 시작하고, 종료 시 멈춘다.
 *
 * 스케줄러는 전용 스레드에서 블로킹으로 실행되며, 그 스레드의 인터럽트가 수집 주기 취소 신호다.
 */
@Component
@Slf4j
public class BackgroundWorkersLifecycle implements SmartLifecycle {

    private final FeedFetchScheduler scheduler;
    private final TranslationWorker translationWorker;
    private final FetcherProperties fetcherProperties;
    private final TranslationProperties translationProperties;
    private final GroqProperties groqProperties;

    private volatile boolean running;
    private Thread schedulerThread;

    public BackgroundWorkersLifecycle(FeedFetchScheduler scheduler,
                                      TranslationWorker translationWorker,
                                      FetcherProperties fetcherProperties,
                                      TranslationProperties translationProperties,
                                      GroqProperties groqProperties) {
        this.scheduler = scheduler;
        this.translationWorker = translationWorker;
        this.fetcherProperties = fetcherProperties;
        this.translationProperties = translationProperties;
        this.groqProperties = groqProperties;
    }

    @Override
    public synchronized void start() {
        if (fetcherProperties.isEnabled()) {
            schedulerThread = new Thread(scheduler::start, "feed-fetch-scheduler");
            schedulerThread.setDaemon(true);
            schedulerThread.start();
        } else {
            log.info("Feed fetch scheduler is disabled via configuration.");
        }

        if (!translationProperties.isEnabled()) {
            log.info("Translation worker is disabled via configuration.");
        } else if (!groqProperties.isConfigured()) {
            log.warn("Translation is enabled but GROQ_API_KEY is not set; translation worker not started.");
        } else {
            translationWorker.start();
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        translationWorker.stop();

        if (schedulerThread != null) {
            scheduler.stop();
            if (schedulerThread.isAlive()) {
                log.warn("Fetch scheduler still busy after stop signal, cancelling in-flight cycle");
                schedulerThread.interrupt();
            }
            schedulerThread = null;
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
