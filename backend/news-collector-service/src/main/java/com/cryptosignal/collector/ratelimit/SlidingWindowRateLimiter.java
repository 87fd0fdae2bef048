package com.cryptosignal.collector.ratelimit;

import com.cryptosignal.collector.config.RateLimitProperties;
import com.cryptosignal.collector.config.RateLimitProperties.TierLimit;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding Window Rate Limiter
 *
 * 식별자마다 1분 / 24시간 두 개의 윈도우를 유지하며, 두 윈도우 모두 여유가 있을 때만 요청을 허용한다.
 * 각 윈도우는 요청 시각(마이크로초)을 점수로 하는 정렬 집합이며, 판정 시 윈도우 밖의 항목을 먼저 제거한다.
 *
 * 저장소에 접근할 수 없으면 요청을 허용한다 (fail-open).
 */
@Slf4j
public class SlidingWindowRateLimiter {

    public static final Duration MINUTE_WINDOW = Duration.ofMinutes(1);
    public static final Duration DAY_WINDOW = Duration.ofHours(24);

    private static final String MINUTE_KEY_PREFIX = "ratelimit:minute:";
    private static final String DAY_KEY_PREFIX = "ratelimit:day:";

    private static final Map<RateLimitTier, TierLimit> DEFAULT_LIMITS = new EnumMap<>(Map.of(
            RateLimitTier.ANONYMOUS, new TierLimit(5, 100),
            RateLimitTier.FREE, new TierLimit(10, 500),
            RateLimitTier.PRO, new TierLimit(60, 10_000),
            RateLimitTier.ENTERPRISE, new TierLimit(300, -1)
    ));

    private final RateLimitStore store;
    private final RateLimitProperties properties;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final Counter rejectedCounter;
    private final Counter failOpenCounter;

    public SlidingWindowRateLimiter(RateLimitStore store, RateLimitProperties properties,
                                    Clock clock, MeterRegistry meterRegistry) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.rejectedCounter = Counter.builder("ratelimit.rejected")
                .description("Requests rejected by the rate limiter")
                .register(meterRegistry);
        this.failOpenCounter = Counter.builder("ratelimit.fail_open")
                .description("Requests admitted because the rate limit store was unreachable")
                .register(meterRegistry);
    }

    public RateLimitDecision check(String identifier, RateLimitTier tier) {
        TierLimit limit = limitFor(tier);
        long nowMicros = toMicros(clock.instant());
        String member = nowMicros + "-" + sequence.incrementAndGet();

        List<RateLimitStore.Window> windows = new ArrayList<>(2);
        windows.add(new RateLimitStore.Window(minuteKey(identifier), MINUTE_WINDOW, limit.getRequestsPerMinute()));
        if (!limit.isDailyUnlimited()) {
            windows.add(new RateLimitStore.Window(dayKey(identifier), DAY_WINDOW, limit.getRequestsPerDay()));
        }

        RateLimitStore.AcquireResult result;
        try {
            result = store.tryAcquire(windows, nowMicros, member);
        } catch (DataAccessException e) {
            failOpenCounter.increment();
            log.warn("Rate limit store unavailable, allowing request (fail-open): identifier={}, error={}",
                    identifier, e.getMessage());
            return new RateLimitDecision(true, limit.getRequestsPerMinute(), limit.getRequestsPerMinute(),
                    toEpochSecondsCeil(nowMicros + windowMicros(MINUTE_WINDOW)), 0, true);
        }

        int added = result.allowed() ? 1 : 0;
        long remaining = Long.MAX_VALUE;
        for (int i = 0; i < windows.size(); i++) {
            long used = result.counts().get(i) + added;
            remaining = Math.min(remaining, Math.max(0, windows.get(i).limit() - used));
        }

        long oldestMinute = result.oldestMicros().get(0);
        long resetBase = oldestMinute < 0 ? nowMicros : oldestMinute;
        long resetAt = toEpochSecondsCeil(resetBase + windowMicros(MINUTE_WINDOW));

        if (result.allowed()) {
            return new RateLimitDecision(true, limit.getRequestsPerMinute(), remaining, resetAt, 0, false);
        }

        long retryAfterMicros = 0;
        for (int i = 0; i < windows.size(); i++) {
            RateLimitStore.Window window = windows.get(i);
            long oldest = result.oldestMicros().get(i);
            if (result.counts().get(i) >= window.limit() && oldest >= 0) {
                retryAfterMicros = Math.max(retryAfterMicros, oldest + windowMicros(window.length()) - nowMicros);
            }
        }
        long retryAfterSeconds = Math.max(1, ceilDiv(retryAfterMicros, 1_000_000L));

        rejectedCounter.increment();
        log.debug("Rate limit exceeded: identifier={}, tier={}, retryAfter={}s",
                identifier, tier.getValue(), retryAfterSeconds);
        return new RateLimitDecision(false, limit.getRequestsPerMinute(), 0, resetAt, retryAfterSeconds, false);
    }

    /**
     * 현재 윈도우별 사용량. 저장소 오류 시 사용량 0 과 storeUnavailable=true 로 한도만 보고한다.
     */
    public RateLimitUsage getUsage(String identifier, RateLimitTier tier) {
        TierLimit limit = limitFor(tier);
        long nowMicros = toMicros(clock.instant());
        int perDay = limit.isDailyUnlimited() ? -1 : limit.getRequestsPerDay();

        long minuteCount;
        long dayCount;
        try {
            minuteCount = store.count(minuteKey(identifier), nowMicros - windowMicros(MINUTE_WINDOW));
            dayCount = limit.isDailyUnlimited()
                    ? 0
                    : store.count(dayKey(identifier), nowMicros - windowMicros(DAY_WINDOW));
        } catch (DataAccessException e) {
            log.warn("Failed to read rate limit usage: identifier={}, error={}", identifier, e.getMessage());
            return new RateLimitUsage(identifier, tier.getValue(),
                    0, limit.getRequestsPerMinute(), limit.getRequestsPerMinute(),
                    0, perDay, perDay, Boolean.TRUE);
        }

        long dayRemaining = limit.isDailyUnlimited() ? -1 : Math.max(0, perDay - dayCount);
        return new RateLimitUsage(identifier, tier.getValue(),
                minuteCount, limit.getRequestsPerMinute(), Math.max(0, limit.getRequestsPerMinute() - minuteCount),
                dayCount, perDay, dayRemaining, null);
    }

    public void reset(String identifier) {
        store.delete(List.of(minuteKey(identifier), dayKey(identifier)));
        log.info("Rate limit counters reset: identifier={}", identifier);
    }

    public Map<RateLimitTier, TierLimit> getLimits() {
        Map<RateLimitTier, TierLimit> limits = new EnumMap<>(RateLimitTier.class);
        for (RateLimitTier tier : RateLimitTier.values()) {
            limits.put(tier, limitFor(tier));
        }
        return Collections.unmodifiableMap(limits);
    }

    public TierLimit limitFor(RateLimitTier tier) {
        TierLimit configured = properties.getTiers().get(tier.getValue());
        return configured != null ? configured : DEFAULT_LIMITS.get(tier);
    }

    static String minuteKey(String identifier) {
        return MINUTE_KEY_PREFIX + identifier;
    }

    static String dayKey(String identifier) {
        return DAY_KEY_PREFIX + identifier;
    }

    private static long toMicros(Instant instant) {
        return TimeUnit.SECONDS.toMicros(instant.getEpochSecond()) + instant.getNano() / 1000;
    }

    private static long windowMicros(Duration window) {
        return window.toNanos() / 1000;
    }

    private static long toEpochSecondsCeil(long micros) {
        return ceilDiv(micros, 1_000_000L);
    }

    private static long ceilDiv(long x, long y) {
        return -Math.floorDiv(-x, y);
    }
}
