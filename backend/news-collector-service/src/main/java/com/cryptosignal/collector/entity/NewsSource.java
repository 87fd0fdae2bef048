package com.cryptosignal.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Duration;
import java.time.Instant;

@Entity
@Table(name = "sources", indexes = {
    @Index(name = "idx_sources_enabled", columnList = "is_enabled"),
    @Index(name = "idx_sources_category", columnList = "category"),
    @Index(name = "idx_sources_language", columnList = "language")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsSource implements FetchableSource {

    /** 연속 오류가 이 값 이상이면 수집 대상에서 제외 */
    public static final int MAX_HEALTHY_ERRORS = 5;

    /** 연속 오류가 이 값 이상이면 백오프 적용 */
    public static final int BACKOFF_ERROR_THRESHOLD = 3;

    private static final long BASE_BACKOFF_MINUTES = 5;
    private static final long MAX_BACKOFF_MINUTES = 120;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "key", nullable = false, unique = true, length = 50)
    private String key;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "rss_url", nullable = false, columnDefinition = "TEXT")
    private String rssUrl;

    @Column(name = "website_url", columnDefinition = "TEXT")
    private String websiteUrl;

    @Column(name = "category", length = 50)
    private String category;

    @Column(name = "language", length = 10)
    @Builder.Default
    private String language = "en";

    @Column(name = "is_enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;

    @Column(name = "reliability_score")
    @Builder.Default
    private Double reliabilityScore = 0.5;

    @Column(name = "last_fetch_at")
    private Instant lastFetchAt;

    @Column(name = "error_count", nullable = false)
    @Builder.Default
    private int errorCount = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Enabled and below the consecutive error threshold.
     */
    public boolean isHealthy() {
        return enabled && errorCount < MAX_HEALTHY_ERRORS;
    }

    public boolean needsBackoff() {
        return errorCount >= BACKOFF_ERROR_THRESHOLD;
    }

    /**
     * 5분 * 2^(errorCount-3), 최대 120분. 임계값 미만이면 0.
     */
    public Duration getBackoffDuration() {
        if (!needsBackoff()) {
            return Duration.ZERO;
        }
        int exponent = Math.min(errorCount - BACKOFF_ERROR_THRESHOLD, 10);
        long minutes = Math.min(BASE_BACKOFF_MINUTES * (1L << exponent), MAX_BACKOFF_MINUTES);
        return Duration.ofMinutes(minutes);
    }
}
