package com.cryptosignal.collector.scheduler;

import com.cryptosignal.collector.config.FetcherProperties;
import com.cryptosignal.collector.service.fetch.FeedFetchOrchestrator;
import com.cryptosignal.collector.service.fetch.FetchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the fetch pipeline immediately and then on every interval tick.
 *
 * <p>{@link #start()} blocks the calling thread until {@link #stop()} is called or the thread is
 * interrupted. Fetches never overlap; a tick missed during a long fetch fires late, once.
 */
@Component
@Slf4j
public class FeedFetchScheduler {

    private final FeedFetchOrchestrator orchestrator;
    private final Clock clock;
    private final Duration stopGracePeriod;
    private final ReentrantLock fetchLock = new ReentrantLock();
    private final Object stateLock = new Object();

    // stateLock 로 보호
    private Duration interval;
    private boolean running;
    private CountDownLatch stopSignal;
    private CountDownLatch stopped;
    private Instant lastFetch;
    private long fetchCount;
    private long errorCount;
    private FetchResult lastResult;

    public FeedFetchScheduler(FeedFetchOrchestrator orchestrator, FetcherProperties fetcherProperties, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
        this.interval = fetcherProperties.getInterval();
        this.stopGracePeriod = fetcherProperties.getStopGracePeriod();
    }

    public void start() {
        CountDownLatch signal;
        CountDownLatch done;
        synchronized (stateLock) {
            if (running) {
                log.info("Fetch scheduler already running");
                return;
            }
            running = true;
            signal = new CountDownLatch(1);
            done = new CountDownLatch(1);
            stopSignal = signal;
            stopped = done;
        }

        log.info("Starting fetch scheduler with interval {}", getInterval());
        try {
            runLoop(signal);
        } finally {
            synchronized (stateLock) {
                running = false;
            }
            done.countDown();
        }
    }

    private void runLoop(CountDownLatch signal) {
        runFetch();

        long nextTick = System.nanoTime() + getInterval().toNanos();
        while (true) {
            long waitNanos = nextTick - System.nanoTime();
            try {
                if (waitNanos > 0 ? signal.await(waitNanos, TimeUnit.NANOSECONDS) : signal.getCount() == 0) {
                    log.info("Fetch scheduler received stop signal");
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Fetch scheduler cancelled");
                return;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.info("Fetch scheduler cancelled");
                return;
            }

            runFetch();

            long intervalNanos = getInterval().toNanos();
            long now = System.nanoTime();
            nextTick += intervalNanos;
            if (nextTick <= now) {
                // 수집이 주기보다 오래 걸림: 밀린 틱 하나만 즉시 실행
                nextTick += ((now - nextTick) / intervalNanos) * intervalNanos;
            }
        }
    }

    /**
     * Signals the loop to exit and waits up to the configured grace period (30s by default).
     * Returns even if the loop is stuck in a fetch; {@link #isRunning()} then stays true.
     */
    public void stop() {
        CountDownLatch signal;
        CountDownLatch done;
        synchronized (stateLock) {
            if (!running) {
                return;
            }
            signal = stopSignal;
            done = stopped;
        }

        log.info("Stopping fetch scheduler...");
        signal.countDown();
        try {
            if (done.await(stopGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Fetch scheduler stopped gracefully");
            } else {
                log.warn("Fetch scheduler stop timed out after {}ms", stopGracePeriod.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for fetch scheduler to stop");
        }
    }

    private void runFetch() {
        log.info("Starting fetch cycle");
        Instant startedAt = clock.instant();
        FetchResult result = null;
        RuntimeException failure = null;

        fetchLock.lock();
        try {
            result = orchestrator.fetchAllEnabledSources();
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            fetchLock.unlock();
        }

        synchronized (stateLock) {
            lastFetch = startedAt;
            fetchCount++;
            if (failure != null) {
                errorCount++;
            } else {
                lastResult = result;
            }
        }

        if (failure != null) {
            log.error("Fetch cycle failed: {}", failure.getMessage(), failure);
        } else {
            log.info("Fetch cycle completed: {} new articles from {} sources in {}ms",
                    result.newArticles(), result.successfulFeeds(), result.duration().toMillis());
        }
    }

    /**
     * Runs one cycle synchronously, outside the periodic loop. Waits for an in-flight cycle first.
     */
    public FetchResult runOnce() {
        fetchLock.lock();
        try {
            return orchestrator.fetchAllEnabledSources();
        } finally {
            fetchLock.unlock();
        }
    }

    public boolean isRunning() {
        synchronized (stateLock) {
            return running;
        }
    }

    public Duration getInterval() {
        synchronized (stateLock) {
            return interval;
        }
    }

    /**
     * Takes effect from the next tick.
     */
    public void setInterval(Duration newInterval) {
        if (newInterval == null || newInterval.isNegative() || newInterval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive: " + newInterval);
        }
        synchronized (stateLock) {
            interval = newInterval;
        }
        log.info("Fetch interval updated to {}", newInterval);
    }

    /**
     * Time until lastFetch + interval; zero when idle, never run, or overdue.
     */
    public Duration nextFetchIn() {
        synchronized (stateLock) {
            return nextFetchInLocked();
        }
    }

    private Duration nextFetchInLocked() {
        if (!running || lastFetch == null) {
            return Duration.ZERO;
        }
        Duration until = Duration.between(clock.instant(), lastFetch.plus(interval));
        return until.isNegative() ? Duration.ZERO : until;
    }

    public SchedulerStats getStats() {
        synchronized (stateLock) {
            return new SchedulerStats(
                    running,
                    interval,
                    lastFetch,
                    fetchCount,
                    errorCount,
                    lastResult != null ? lastResult.successfulFeeds() : 0,
                    lastResult != null ? lastResult.failedFeeds() : 0,
                    lastResult != null ? lastResult.newArticles() : 0,
                    lastResult != null ? lastResult.duration() : Duration.ZERO,
                    nextFetchInLocked());
        }
    }
}
