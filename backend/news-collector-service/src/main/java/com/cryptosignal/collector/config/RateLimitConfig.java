package com.cryptosignal.collector.config;

import com.cryptosignal.collector.ratelimit.InMemoryRateLimitStore;
import com.cryptosignal.collector.ratelimit.RateLimitFilter;
import com.cryptosignal.collector.ratelimit.RateLimitStore;
import com.cryptosignal.collector.ratelimit.RedisRateLimitStore;
import com.cryptosignal.collector.ratelimit.SlidingWindowRateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * API Rate Limit 구성
 *
 * collector.rate-limit.store=memory 이면 프로세스 메모리에, 그 외에는 Redis 에 윈도우를 저장한다.
 */
@Configuration
@Slf4j
public class RateLimitConfig {

    @Bean
    public RateLimitStore rateLimitStore(RateLimitProperties properties,
                                         ObjectProvider<StringRedisTemplate> redisTemplate) {
        if ("memory".equalsIgnoreCase(properties.getStore())) {
            log.info("Rate limit store: in-memory (single instance only)");
            return new InMemoryRateLimitStore();
        }
        log.info("Rate limit store: redis");
        return new RedisRateLimitStore(redisTemplate.getObject());
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(RateLimitStore rateLimitStore,
                                                             RateLimitProperties properties,
                                                             Clock clock,
                                                             MeterRegistry meterRegistry) {
        return new SlidingWindowRateLimiter(rateLimitStore, properties, clock, meterRegistry);
    }

    @Bean
    @ConditionalOnProperty(prefix = "collector.rate-limit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FilterRegistrationBean<RateLimitFilter> rateLimitFilter(SlidingWindowRateLimiter rateLimiter,
                                                                   ObjectMapper objectMapper) {
        FilterRegistrationBean<RateLimitFilter> registration =
                new FilterRegistrationBean<>(new RateLimitFilter(rateLimiter, objectMapper));
        registration.addUrlPatterns("/api/*");
        registration.setName("rateLimitFilter");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
