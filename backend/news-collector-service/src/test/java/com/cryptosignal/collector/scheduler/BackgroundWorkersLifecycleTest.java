package com.cryptosignal.collector.scheduler;

import com.cryptosignal.collector.config.FetcherProperties;
import com.cryptosignal.collector.config.GroqProperties;
import com.cryptosignal.collector.config.TranslationProperties;
import com.cryptosignal.collector.service.fetch.FeedFetchOrchestrator;
import com.cryptosignal.collector.service.fetch.FetchResult;
import com.cryptosignal.collector.service.translation.TranslationWorker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * BackgroundWorkersLifecycle 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class BackgroundWorkersLifecycleTest {

    private static final FetchResult RESULT =
            new FetchResult(1, 1, 0, 1, 1, Duration.ofMillis(5), List.of());

    @Mock
    private FeedFetchOrchestrator orchestrator;

    @Mock
    private TranslationWorker translationWorker;

    private FetcherProperties fetcherProperties;
    private TranslationProperties translationProperties;
    private GroqProperties groqProperties;

    @BeforeEach
    void setUp() {
        fetcherProperties = new FetcherProperties();
        fetcherProperties.setStopGracePeriod(Duration.ofMillis(200));
        translationProperties = new TranslationProperties();
        groqProperties = new GroqProperties();
    }

    @Test
    @DisplayName("유예 시간 안에 멈추지 않는 수집 주기는 스레드 인터럽트로 취소")
    void interruptsStuckSchedulerThreadOnStop() throws Exception {
        // given
        translationProperties.setEnabled(false);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(orchestrator.fetchAllEnabledSources()).thenAnswer(inv -> {
            entered.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return RESULT;
        });
        FeedFetchScheduler scheduler = new FeedFetchScheduler(orchestrator, fetcherProperties, Clock.systemUTC());
        BackgroundWorkersLifecycle lifecycle = new BackgroundWorkersLifecycle(
                scheduler, translationWorker, fetcherProperties, translationProperties, groqProperties);

        lifecycle.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        lifecycle.stop();

        // then
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(awaitStopped(scheduler)).isTrue();
        assertThat(lifecycle.isRunning()).isFalse();
        verify(translationWorker).stop();
        verify(translationWorker, never()).start();
    }

    @Test
    @DisplayName("API 키가 없으면 번역 워커를 시작하지 않음")
    void skipsTranslationWorkerWithoutApiKey() {
        // given
        fetcherProperties.setEnabled(false);
        FeedFetchScheduler scheduler = new FeedFetchScheduler(orchestrator, fetcherProperties, Clock.systemUTC());
        BackgroundWorkersLifecycle lifecycle = new BackgroundWorkersLifecycle(
                scheduler, translationWorker, fetcherProperties, translationProperties, groqProperties);

        // when
        lifecycle.start();

        // then
        assertThat(lifecycle.isRunning()).isTrue();
        verify(translationWorker, never()).start();
        lifecycle.stop();
    }

    @Test
    @DisplayName("번역이 켜져 있고 API 키가 있으면 번역 워커 시작")
    void startsTranslationWorkerWhenConfigured() {
        // given
        fetcherProperties.setEnabled(false);
        groqProperties.setApiKey("gsk-test");
        FeedFetchScheduler scheduler = new FeedFetchScheduler(orchestrator, fetcherProperties, Clock.systemUTC());
        BackgroundWorkersLifecycle lifecycle = new BackgroundWorkersLifecycle(
                scheduler, translationWorker, fetcherProperties, translationProperties, groqProperties);

        // when
        lifecycle.start();
        lifecycle.stop();

        // then
        verify(translationWorker).start();
        verify(translationWorker).stop();
    }

    private static boolean awaitStopped(FeedFetchScheduler scheduler) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (scheduler.isRunning() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(5);
        }
        return !scheduler.isRunning();
    }
}
