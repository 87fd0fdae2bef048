package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.NewsSource;
import com.cryptosignal.collector.exception.FeedFetchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class FetchWorkerPoolTest {

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setThreadNamePrefix("test-fetch-");
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("완료 순서와 무관하게 입력 순서대로 결과 반환")
    void resultsFollowInputOrder() {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 3, 0, Duration.ofMillis(10));
        List<String> completionOrder = new CopyOnWriteArrayList<>();
        List<FetchJob> jobs = List.of(
                delayedJob(source(1L, "a"), 300, completionOrder),
                delayedJob(source(2L, "b"), 150, completionOrder),
                delayedJob(source(3L, "c"), 0, completionOrder));

        // when
        List<FetchJobResult> results = pool.processJobs(jobs, Duration.ofSeconds(5));

        // then
        assertThat(completionOrder).first().isEqualTo("c");
        assertThat(results).extracting(FetchJobResult::sourceKey).containsExactly("a", "b", "c");
        assertThat(results).allMatch(FetchJobResult::isSuccess);
    }

    @Test
    @DisplayName("계속 실패하는 작업은 1 + maxRetries 번 시도 후 마지막 오류를 반환")
    void exhaustsRetries() {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 2, 2, Duration.ofMillis(10));
        AtomicInteger attempts = new AtomicInteger();
        FetchJob job = new FetchJob(source(1L, "slow"), (src, timeout) -> {
            attempts.incrementAndGet();
            throw new FeedFetchException(src.getRssUrl(), "Timed out after 10000ms fetching " + src.getRssUrl());
        });

        // when
        FetchJobResult result = pool.processJobs(List.of(job), Duration.ofSeconds(5)).get(0);

        // then
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).isInstanceOf(FeedFetchException.class).hasMessageContaining("Timed out");
        assertThat(result.retryCount()).isEqualTo(2);
        assertThat(result.articles()).isEmpty();
    }

    @Test
    @DisplayName("재시도 중 성공하면 성공 결과와 시도 인덱스를 반환")
    void succeedsAfterRetry() {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 2, 2, Duration.ofMillis(10));
        AtomicInteger attempts = new AtomicInteger();
        FetchJob job = new FetchJob(source(1L, "flaky"), (src, timeout) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new FeedFetchException(src.getRssUrl(), 502);
            }
            return List.of(Article.builder().guid("g1").build());
        });

        // when
        FetchJobResult result = pool.processJobs(List.of(job), Duration.ofSeconds(5)).get(0);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(result.articles()).hasSize(1);
    }

    @Test
    @DisplayName("백오프가 작업 마감 시각을 넘기면 재시도하지 않고 타임아웃")
    void stopsRetryingAtDeadline() {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 2, 2, Duration.ofSeconds(1));
        AtomicInteger attempts = new AtomicInteger();
        FetchJob job = new FetchJob(source(1L, "down"), (src, timeout) -> {
            attempts.incrementAndGet();
            throw new FeedFetchException(src.getRssUrl(), "connection refused");
        });

        // when
        FetchJobResult result = pool.processJobs(List.of(job), Duration.ofMillis(200)).get(0);

        // then
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.error()).isInstanceOf(TimeoutException.class);
        assertThat(result.retryCount()).isZero();
    }

    @Test
    @DisplayName("동시 실행 수는 maxWorkers 를 넘지 않음")
    void limitsConcurrency() {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 2, 0, Duration.ofMillis(10));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        SourceFetcher fetcher = (src, timeout) -> {
            int now = active.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                TimeUnit.MILLISECONDS.sleep(50);
            } finally {
                active.decrementAndGet();
            }
            return List.of();
        };
        List<FetchJob> jobs = List.of(
                new FetchJob(source(1L, "s1"), fetcher), new FetchJob(source(2L, "s2"), fetcher),
                new FetchJob(source(3L, "s3"), fetcher), new FetchJob(source(4L, "s4"), fetcher),
                new FetchJob(source(5L, "s5"), fetcher), new FetchJob(source(6L, "s6"), fetcher));

        // when
        List<FetchJobResult> results = pool.processJobs(jobs, Duration.ofSeconds(5));

        // then
        assertThat(results).hasSize(6).allMatch(FetchJobResult::isSuccess);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("호출 스레드가 인터럽트되면 진행 중인 작업을 취소하고 인터럽트 상태를 복원")
    void cancelsOnInterrupt() throws Exception {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 2, 0, Duration.ofMillis(10));
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch never = new CountDownLatch(1);
        SourceFetcher blocking = (src, timeout) -> {
            started.countDown();
            never.await();
            return List.of();
        };
        List<FetchJob> jobs = List.of(new FetchJob(source(1L, "x"), blocking), new FetchJob(source(2L, "y"), blocking));

        AtomicReference<List<FetchJobResult>> results = new AtomicReference<>();
        AtomicBoolean interruptedAfter = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            results.set(pool.processJobs(jobs, Duration.ofSeconds(30)));
            interruptedAfter.set(Thread.currentThread().isInterrupted());
        });

        // when
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5_000);

        // then
        assertThat(caller.isAlive()).isFalse();
        assertThat(interruptedAfter.get()).isTrue();
        assertThat(results.get()).hasSize(2)
                .allSatisfy(r -> assertThat(r.error()).isInstanceOf(CancellationException.class));
        assertThat(results.get()).extracting(FetchJobResult::sourceKey).containsExactly("x", "y");
    }

    @Test
    @DisplayName("실행자가 작업을 거부하면 대기하지 않고 실패 결과로 기록")
    void rejectedJobsBecomeFailures() {
        // given
        FetchWorkerPool pool = new FetchWorkerPool(executor, 2, 0, Duration.ofMillis(10));
        executor.shutdown();
        List<FetchJob> jobs = List.of(
                delayedJob(source(1L, "a"), 0, new CopyOnWriteArrayList<>()),
                delayedJob(source(2L, "b"), 0, new CopyOnWriteArrayList<>()));

        // when
        List<FetchJobResult> results = pool.processJobs(jobs, Duration.ofSeconds(5));

        // then
        assertThat(results).extracting(FetchJobResult::sourceKey).containsExactly("a", "b");
        assertThat(results).allSatisfy(r -> {
            assertThat(r.isSuccess()).isFalse();
            assertThat(r.error()).isInstanceOf(TaskRejectedException.class);
        });
    }

    private static FetchJob delayedJob(NewsSource source, long delayMillis, List<String> completionOrder) {
        return new FetchJob(source, (src, timeout) -> {
            TimeUnit.MILLISECONDS.sleep(delayMillis);
            completionOrder.add(src.getKey());
            return List.of(Article.builder().guid(src.getKey() + "-1").build());
        });
    }

    private static NewsSource source(Long id, String key) {
        return NewsSource.builder()
                .id(id)
                .key(key)
                .name(key)
                .rssUrl("https://" + key + ".example.com/rss")
                .build();
    }
}
