package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.FetchableSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fetch jobs concurrently behind a fixed-size admission gate.
 *
 * <p>Every job gets its own deadline (started once it holds a slot) shared by all of its attempts.
 * A failed attempt is retried up to {@code maxRetries} times, waiting {@code attempt * retryBackoff}
 * in between, unless the deadline has passed. Results are index-aligned with the input jobs.
 *
 * <p>Interrupting the thread that called {@link #processJobs} cancels the cycle: queued jobs, jobs
 * waiting for a slot and jobs sleeping between retries resolve to a {@link CancellationException}
 * result, and the interrupt flag is restored before returning.
 */
@Slf4j
public class FetchWorkerPool {

    private static final int PROGRESS_LOG_INTERVAL = 25;

    private final AsyncTaskExecutor executor;
    private final Semaphore gate;
    private final int maxWorkers;
    private final int maxRetries;
    private final Duration retryBackoff;

    public FetchWorkerPool(AsyncTaskExecutor executor, int maxWorkers, int maxRetries, Duration retryBackoff) {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive: " + maxWorkers);
        }
        this.executor = executor;
        this.gate = new Semaphore(maxWorkers, true);
        this.maxWorkers = maxWorkers;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBackoff = retryBackoff;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public List<FetchJobResult> processJobs(List<FetchJob> jobs, Duration timeout) {
        if (jobs.isEmpty()) {
            return List.of();
        }

        int total = jobs.size();
        AtomicInteger completed = new AtomicInteger();
        List<Future<FetchJobResult>> futures = new ArrayList<>(total);
        for (FetchJob job : jobs) {
            try {
                futures.add(executor.submit(() -> runGated(job, timeout, completed, total)));
            } catch (TaskRejectedException e) {
                log.warn("Fetch job for {} rejected by executor: {}", job.source().getKey(), e.getMessage());
                futures.add(CompletableFuture.completedFuture(
                        FetchJobResult.failure(job.source(), e, Duration.ZERO, 0)));
            }
        }

        List<FetchJobResult> results = new ArrayList<>(total);
        boolean cancelled = false;
        for (int i = 0; i < total; i++) {
            FetchJob job = jobs.get(i);
            Future<FetchJobResult> future = futures.get(i);
            if (cancelled) {
                results.add(resultAfterCancel(job, future));
                continue;
            }
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                cancelled = true;
                log.warn("Fetch cycle cancelled with {}/{} sources completed", completed.get(), total);
                futures.forEach(f -> f.cancel(true));
                results.add(resultAfterCancel(job, future));
            } catch (ExecutionException e) {
                results.add(FetchJobResult.failure(job.source(), e.getCause(), Duration.ZERO, 0));
            } catch (CancellationException e) {
                results.add(cancelledResult(job.source(), Duration.ZERO, 0));
            }
        }

        if (cancelled) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private FetchJobResult runGated(FetchJob job, Duration timeout, AtomicInteger completed, int total) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return cancelledResult(job.source(), Duration.ZERO, 0);
        }

        try {
            FetchJobResult result = executeJob(job, timeout);
            int done = completed.incrementAndGet();
            if (done % PROGRESS_LOG_INTERVAL == 0 || done == total) {
                log.info("Fetch progress: {}/{} sources fetched", done, total);
            }
            return result;
        } finally {
            gate.release();
        }
    }

    FetchJobResult executeJob(FetchJob job, Duration timeout) {
        FetchableSource source = job.source();
        long startedAt = System.nanoTime();
        long deadline = startedAt + timeout.toNanos();
        Throwable lastError = null;
        int retries = 0;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                long backoffNanos = retryBackoff.toNanos() * attempt;
                if (System.nanoTime() + backoffNanos >= deadline) {
                    lastError = new TimeoutException("Fetch deadline of " + timeout.toMillis()
                            + "ms exceeded for " + source.getKey());
                    break;
                }
                try {
                    TimeUnit.NANOSECONDS.sleep(backoffNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return cancelledResult(source, elapsedSince(startedAt), retries);
                }
            }

            Duration remaining = Duration.ofNanos(deadline - System.nanoTime());
            if (remaining.isNegative() || remaining.isZero()) {
                lastError = new TimeoutException("Fetch deadline of " + timeout.toMillis()
                        + "ms exceeded for " + source.getKey());
                break;
            }

            retries = attempt;
            try {
                List<Article> articles = job.fetcher().fetch(source, remaining);
                return FetchJobResult.success(source, articles, elapsedSince(startedAt), attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return cancelledResult(source, elapsedSince(startedAt), retries);
            } catch (RuntimeException e) {
                lastError = e;
                log.debug("Fetch attempt {} for {} failed: {}", attempt + 1, source.getKey(), e.getMessage());
            }
        }

        return FetchJobResult.failure(source, lastError, elapsedSince(startedAt), retries);
    }

    private FetchJobResult resultAfterCancel(FetchJob job, Future<FetchJobResult> future) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (ExecutionException e) {
                return FetchJobResult.failure(job.source(), e.getCause(), Duration.ZERO, 0);
            } catch (InterruptedException | CancellationException e) {
                return cancelledResult(job.source(), Duration.ZERO, 0);
            }
        }
        return cancelledResult(job.source(), Duration.ZERO, 0);
    }

    private static FetchJobResult cancelledResult(FetchableSource source, Duration elapsed, int retries) {
        return FetchJobResult.failure(source,
                new CancellationException("Fetch cancelled for " + source.getKey()), elapsed, retries);
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
