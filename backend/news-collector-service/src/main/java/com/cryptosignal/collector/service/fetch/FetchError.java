package com.cryptosignal.collector.service.fetch;

public record FetchError(Long sourceId, String sourceKey, String message) {

    static FetchError from(FetchJobResult result) {
        Throwable error = result.error();
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new FetchError(result.sourceId(), result.sourceKey(), message);
    }
}
