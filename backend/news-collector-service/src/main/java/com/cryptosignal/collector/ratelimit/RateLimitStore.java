package com.cryptosignal.collector.ratelimit;

import java.time.Duration;
import java.util.List;

/**
 * Shared store of per-key, time-ordered request records. Scores are epoch microseconds.
 */
public interface RateLimitStore {

    record Window(String key, Duration length, int limit) {
    }

    /**
     * @param counts       entries inside each window after purging, before this request
     * @param oldestMicros score of the oldest remaining entry per window, -1 when empty
     */
    record AcquireResult(boolean allowed, List<Long> counts, List<Long> oldestMicros) {
    }

    /**
     * For every window: drop entries at or before {@code now - length} and count the rest.
     * If every count is below its limit, record {@code member} at {@code nowMicros} in all windows
     * and refresh their expiry to length + 1s. Must be atomic per call.
     */
    AcquireResult tryAcquire(List<Window> windows, long nowMicros, String member);

    /**
     * Entries with score strictly after {@code windowStartMicros}.
     */
    long count(String key, long windowStartMicros);

    void delete(List<String> keys);
}
