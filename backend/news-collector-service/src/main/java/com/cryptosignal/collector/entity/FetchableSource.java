package com.cryptosignal.collector.entity;

/**
 * Minimal view of a feed origin needed to fetch it.
 */
public interface FetchableSource {

    Long getId();

    String getKey();

    String getName();

    String getRssUrl();

    String getCategory();

    String getLanguage();

    boolean isEnabled();
}
