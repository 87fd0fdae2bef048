package com.cryptosignal.collector.service.feed;

import com.cryptosignal.collector.config.FetcherProperties;
import com.cryptosignal.collector.exception.FeedFetchException;
import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * RSS/Atom 피드 다운로드 및 파싱 (Rome)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RssFeedService {

    private static final String ACCEPT = "application/rss+xml, application/atom+xml, application/xml, text/xml, */*";

    private final HttpClient feedHttpClient;
    private final FetcherProperties fetcherProperties;
    private final Clock clock;

    /**
     * 피드를 조회하고 파싱
     *
     * @param url     feed URL
     * @param timeout upper bound for the whole HTTP exchange, body included
     * @throws FeedFetchException   on network, HTTP status or XML errors
     * @throws InterruptedException when the calling thread is cancelled
     */
    public List<FeedItem> fetchAndParse(String url, Duration timeout) throws InterruptedException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("User-Agent", fetcherProperties.getUserAgent())
                    .header("Accept", ACCEPT)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException(url, "Invalid feed URL: " + url, e);
        }

        CompletableFuture<HttpResponse<byte[]>> exchange =
                feedHttpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        HttpResponse<byte[]> response;
        try {
            // headers and body share the same deadline
            response = exchange.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            throw new FeedFetchException(url, "Timed out after " + timeout.toMillis() + "ms fetching " + url, e);
        } catch (InterruptedException e) {
            exchange.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw new FeedFetchException(url, "Timed out after " + timeout.toMillis() + "ms fetching " + url, cause);
            }
            throw new FeedFetchException(url, "Failed to fetch " + url + ": " + cause.getMessage(), cause);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new FeedFetchException(url, status);
        }

        byte[] body = response.body() != null ? response.body() : new byte[0];
        return parse(new ByteArrayInputStream(body), url);
    }

    /**
     * Parses a feed document. Entries that cannot be converted are skipped.
     */
    public List<FeedItem> parse(InputStream in, String url) {
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new XmlReader(in));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedFetchException(url, "Malformed feed at " + url + ": " + e.getMessage(), e);
        }

        List<FeedItem> items = new ArrayList<>(feed.getEntries().size());
        for (SyndEntry entry : feed.getEntries()) {
            try {
                items.add(toFeedItem(entry));
            } catch (RuntimeException e) {
                log.warn("Skipping unparsable entry in {}: {}", url, e.getMessage());
            }
        }
        log.debug("Parsed {} entries from {}", items.size(), url);
        return items;
    }

    private FeedItem toFeedItem(SyndEntry entry) {
        String title = trim(entry.getTitle());
        String link = trim(entry.getLink());

        String description = entry.getDescription() != null ? entry.getDescription().getValue() : null;
        String content = entry.getContents().stream()
                .map(SyndContent::getValue)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);

        List<String> categories = entry.getCategories().stream()
                .map(SyndCategory::getName)
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .toList();

        return new FeedItem(extractGuid(entry, title, link), title, link, description, content,
                extractPublishedAt(entry), categories);
    }

    /**
     * guid, 없으면 link, 둘 다 없으면 제목+게시일 해시
     */
    private String extractGuid(SyndEntry entry, String title, String link) {
        String uri = trim(entry.getUri());
        if (!uri.isEmpty()) {
            return uri;
        }
        if (!link.isEmpty()) {
            return link;
        }
        Date published = entry.getPublishedDate();
        String seed = title + (published != null ? published.toInstant().toString() : "");
        return "generated-" + Integer.toHexString(seed.hashCode());
    }

    private Instant extractPublishedAt(SyndEntry entry) {
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        return date != null ? date.toInstant() : clock.instant();
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
