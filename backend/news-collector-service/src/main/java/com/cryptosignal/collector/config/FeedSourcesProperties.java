package com.cryptosignal.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only table of configured feed sources.
 *
 * Bound once at startup from application.yml (collector.sources) and injected wherever
 * source metadata is needed; the seeder copies it into the sources table.
 */
@ConfigurationProperties(prefix = "collector.sources")
@Data
public class FeedSourcesProperties {

    /**
     * Insert configured sources that are missing from the database on startup
     */
    private boolean seedEnabled = true;

    private List<SourceEntry> entries = new ArrayList<>();

    @Data
    public static class SourceEntry {
        /**
         * Unique key, e.g. "coindesk"
         */
        private String key;

        private String name;

        private String rssUrl;

        private String websiteUrl;

        /**
         * Topic hint used when feed items carry no categories
         */
        private String category;

        private String language = "en";

        private boolean enabled = true;

        private double reliabilityScore = 0.5;
    }
}
