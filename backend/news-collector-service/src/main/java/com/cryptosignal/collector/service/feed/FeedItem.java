package com.cryptosignal.collector.service.feed;

import java.time.Instant;
import java.util.List;

/**
 * One normalized RSS/Atom entry. Categories are never null.
 */
public record FeedItem(
        String guid,
        String title,
        String link,
        String description,
        String content,
        Instant publishedAt,
        List<String> categories
) {

    public FeedItem {
        categories = categories != null ? List.copyOf(categories) : List.of();
    }

    /**
     * Full content when the feed provides it, otherwise the summary.
     */
    public String bestDescription() {
        if (content != null && !content.isBlank()) {
            return content;
        }
        return description != null ? description : "";
    }
}
