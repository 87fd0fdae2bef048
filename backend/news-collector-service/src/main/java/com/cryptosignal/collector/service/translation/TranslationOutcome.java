package com.cryptosignal.collector.service.translation;

public record TranslationOutcome(String title, String description, TranslationFailure failure) {

    public static TranslationOutcome success(String title, String description) {
        return new TranslationOutcome(title, description, null);
    }

    public static TranslationOutcome failure(TranslationFailure failure) {
        return new TranslationOutcome(null, null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
