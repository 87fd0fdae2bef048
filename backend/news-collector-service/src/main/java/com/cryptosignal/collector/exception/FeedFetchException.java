package com.cryptosignal.collector.exception;

/**
 * Transient failure fetching or parsing a single feed.
 */
public class FeedFetchException extends CollectorException {

    private final String url;
    private final Integer statusCode;

    public FeedFetchException(String url, String message) {
        super("FEED_FETCH_FAILED", message);
        this.url = url;
        this.statusCode = null;
    }

    public FeedFetchException(String url, int statusCode) {
        super("FEED_FETCH_FAILED", "Unexpected HTTP status " + statusCode + " from " + url);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FeedFetchException(String url, String message, Throwable cause) {
        super("FEED_FETCH_FAILED", message, cause);
        this.url = url;
        this.statusCode = null;
    }

    public String getUrl() {
        return url;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
