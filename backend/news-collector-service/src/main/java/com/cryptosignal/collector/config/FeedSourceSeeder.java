package com.cryptosignal.collector.config;

import com.cryptosignal.collector.config.FeedSourcesProperties.SourceEntry;
import com.cryptosignal.collector.entity.NewsSource;
import com.cryptosignal.collector.repository.NewsSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Copies the configured feed sources (collector.sources.entries) into the sources table.
 * Existing keys are left untouched so runtime state (error count, enabled flag) survives restarts.
 *
 * Profiles:
 * - default: Runs automatically
 * - no-seed: Skip seeding
 */
@Component
@Profile("!no-seed")
@RequiredArgsConstructor
@Slf4j
public class FeedSourceSeeder implements ApplicationRunner {

    private final NewsSourceRepository newsSourceRepository;
    private final FeedSourcesProperties feedSourcesProperties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!feedSourcesProperties.isSeedEnabled()) {
            log.info("Feed source seeding is disabled via configuration.");
            return;
        }

        int created = 0;
        int skipped = 0;
        for (SourceEntry entry : feedSourcesProperties.getEntries()) {
            if (entry.getKey() == null || entry.getRssUrl() == null) {
                log.warn("Skipping source entry without key or rss-url: {}", entry);
                continue;
            }
            if (newsSourceRepository.existsByKey(entry.getKey())) {
                skipped++;
                continue;
            }
            newsSourceRepository.save(toNewsSource(entry));
            created++;
        }

        log.info("Feed source seeding completed. created={}, skipped={}", created, skipped);
    }

    static NewsSource toNewsSource(SourceEntry entry) {
        return NewsSource.builder()
                .key(entry.getKey())
                .name(entry.getName() != null ? entry.getName() : entry.getKey())
                .rssUrl(entry.getRssUrl())
                .websiteUrl(entry.getWebsiteUrl())
                .category(entry.getCategory())
                .language(entry.getLanguage())
                .enabled(entry.isEnabled())
                .reliabilityScore(entry.getReliabilityScore())
                .build();
    }
}
