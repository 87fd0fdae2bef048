package com.cryptosignal.collector.ratelimit;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis sorted-set implementation. Purge, count and conditional insert run in one Lua script,
 * so concurrent requests for the same identifier cannot overshoot a limit.
 */
public class RedisRateLimitStore implements RateLimitStore {

    private static final String ACQUIRE_SCRIPT = """
            local now = tonumber(ARGV[1])
            local member = ARGV[2]
            local allowed = 1
            local counts = {}
            local oldest = {}
            for i = 1, #KEYS do
              local base = 2 + (i - 1) * 3
              local window = tonumber(ARGV[base + 1])
              local limit = tonumber(ARGV[base + 2])
              redis.call('ZREMRANGEBYSCORE', KEYS[i], '-inf', now - window)
              local count = redis.call('ZCARD', KEYS[i])
              counts[i] = count
              local first = redis.call('ZRANGE', KEYS[i], 0, 0, 'WITHSCORES')
              if first[2] then oldest[i] = tonumber(first[2]) else oldest[i] = -1 end
              if count >= limit then allowed = 0 end
            end
            if allowed == 1 then
              for i = 1, #KEYS do
                local base = 2 + (i - 1) * 3
                redis.call('ZADD', KEYS[i], now, member)
                redis.call('PEXPIRE', KEYS[i], tonumber(ARGV[base + 3]))
              end
            end
            local result = {allowed}
            for i = 1, #KEYS do
              table.insert(result, counts[i])
              table.insert(result, oldest[i])
            end
            return result
            """;

    @SuppressWarnings("rawtypes")
    private static final RedisScript<List> SCRIPT = new DefaultRedisScript<>(ACQUIRE_SCRIPT, List.class);

    private static final long EXPIRY_SLACK_MILLIS = 1000;

    private final StringRedisTemplate redis;

    public RedisRateLimitStore(StringRedisTemplate redis) {
        if (redis == null) {
            throw new IllegalArgumentException("redis must not be null");
        }
        this.redis = redis;
    }

    @Override
    public AcquireResult tryAcquire(List<Window> windows, long nowMicros, String member) {
        List<String> keys = new ArrayList<>(windows.size());
        List<String> args = new ArrayList<>(2 + windows.size() * 3);
        args.add(Long.toString(nowMicros));
        args.add(member);
        for (Window window : windows) {
            keys.add(window.key());
            args.add(Long.toString(window.length().toNanos() / 1000));
            args.add(Integer.toString(window.limit()));
            args.add(Long.toString(window.length().toMillis() + EXPIRY_SLACK_MILLIS));
        }

        List<?> raw = redis.execute(SCRIPT, keys, args.toArray());
        if (raw == null || raw.size() != 1 + windows.size() * 2) {
            throw new IllegalStateException("Unexpected rate limit script reply: " + raw);
        }

        List<Long> counts = new ArrayList<>(windows.size());
        List<Long> oldest = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            counts.add(toLong(raw.get(1 + i * 2)));
            oldest.add(toLong(raw.get(2 + i * 2)));
        }
        return new AcquireResult(toLong(raw.get(0)) == 1L, counts, oldest);
    }

    @Override
    public long count(String key, long windowStartMicros) {
        Long count = redis.opsForZSet().count(key, Math.nextUp((double) windowStartMicros), Double.POSITIVE_INFINITY);
        return count == null ? 0L : count;
    }

    @Override
    public void delete(List<String> keys) {
        redis.delete(keys);
    }

    private static long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
