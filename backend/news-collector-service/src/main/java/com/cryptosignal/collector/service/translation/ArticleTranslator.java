package com.cryptosignal.collector.service.translation;

/**
 * Translates an article's title and description from its source language.
 * Failures are reported in the returned outcome, never thrown.
 */
public interface ArticleTranslator {

    TranslationOutcome translate(String title, String description, String sourceLanguage);
}
