package com.cryptosignal.collector.ratelimit;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * 단일 인스턴스용 메모리 저장소. 테스트와 Redis 없는 로컬 실행에 사용.
 * 만료된 키는 접근 시 또는 주기적인 정리에서 제거된다.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final long SWEEP_INTERVAL_MICROS = TimeUnit.MINUTES.toMicros(1);
    private static final long EXPIRY_SLACK_MICROS = TimeUnit.SECONDS.toMicros(1);

    private record Entry(long score, String member) implements Comparable<Entry> {
        @Override
        public int compareTo(Entry other) {
            int byScore = Long.compare(score, other.score);
            return byScore != 0 ? byScore : member.compareTo(other.member);
        }
    }

    private static final class Record {
        final TreeSet<Entry> entries = new TreeSet<>();
        long expiresAtMicros;
    }

    private final Map<String, Record> records = new HashMap<>();
    private long lastSweepMicros;

    @Override
    public synchronized AcquireResult tryAcquire(List<Window> windows, long nowMicros, String member) {
        sweepIfDue(nowMicros);

        boolean allowed = true;
        List<Long> counts = new ArrayList<>(windows.size());
        List<Long> oldest = new ArrayList<>(windows.size());
        for (Window window : windows) {
            Record record = liveRecord(window.key(), nowMicros);
            long windowMicros = window.length().toNanos() / 1000;
            if (record != null) {
                record.entries.headSet(new Entry(nowMicros - windowMicros + 1, ""), false).clear();
            }
            long count = record == null ? 0 : record.entries.size();
            counts.add(count);
            oldest.add(record == null || record.entries.isEmpty() ? -1L : record.entries.first().score());
            if (count >= window.limit()) {
                allowed = false;
            }
        }

        if (allowed) {
            for (Window window : windows) {
                Record record = records.computeIfAbsent(window.key(), k -> new Record());
                record.entries.add(new Entry(nowMicros, member));
                record.expiresAtMicros = nowMicros + window.length().toNanos() / 1000 + EXPIRY_SLACK_MICROS;
            }
        }
        return new AcquireResult(allowed, counts, oldest);
    }

    @Override
    public synchronized long count(String key, long windowStartMicros) {
        Record record = records.get(key);
        if (record == null) {
            return 0;
        }
        return record.entries.tailSet(new Entry(windowStartMicros + 1, ""), true).size();
    }

    @Override
    public synchronized void delete(List<String> keys) {
        keys.forEach(records::remove);
    }

    synchronized int size() {
        return records.size();
    }

    private Record liveRecord(String key, long nowMicros) {
        Record record = records.get(key);
        if (record != null && record.expiresAtMicros <= nowMicros) {
            records.remove(key);
            return null;
        }
        return record;
    }

    private void sweepIfDue(long nowMicros) {
        if (nowMicros - lastSweepMicros < SWEEP_INTERVAL_MICROS) {
            return;
        }
        lastSweepMicros = nowMicros;
        Iterator<Record> it = records.values().iterator();
        while (it.hasNext()) {
            if (it.next().expiresAtMicros <= nowMicros) {
                it.remove();
            }
        }
    }
}
