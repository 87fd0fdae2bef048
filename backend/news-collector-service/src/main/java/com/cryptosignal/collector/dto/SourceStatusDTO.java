package com.cryptosignal.collector.dto;

import com.cryptosignal.collector.entity.NewsSource;

import java.time.Instant;

/**
 * 소스 상태 응답. backoffMinutes 는 오류 누적으로 백오프 대상일 때만 0 보다 크다.
 */
public record SourceStatusDTO(
        Long id,
        String key,
        String name,
        String rssUrl,
        String category,
        String language,
        boolean enabled,
        boolean healthy,
        int errorCount,
        long backoffMinutes,
        Instant lastFetchAt
) {
    public static SourceStatusDTO from(NewsSource source) {
        return new SourceStatusDTO(
                source.getId(),
                source.getKey(),
                source.getName(),
                source.getRssUrl(),
                source.getCategory(),
                source.getLanguage(),
                source.isEnabled(),
                source.isHealthy(),
                source.getErrorCount(),
                source.getBackoffDuration().toMinutes(),
                source.getLastFetchAt()
        );
    }
}
