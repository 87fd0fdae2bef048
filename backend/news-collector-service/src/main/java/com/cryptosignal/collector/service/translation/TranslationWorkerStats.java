package com.cryptosignal.collector.service.translation;

import java.time.Instant;

public record TranslationWorkerStats(
        boolean running,
        Instant backoffUntil,
        long batchesProcessed,
        long translatedCount,
        long failedCount
) {
}
