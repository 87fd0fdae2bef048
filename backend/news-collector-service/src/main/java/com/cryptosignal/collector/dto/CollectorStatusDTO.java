package com.cryptosignal.collector.dto;

import com.cryptosignal.collector.entity.TranslationStatus;
import com.cryptosignal.collector.scheduler.SchedulerStats;
import com.cryptosignal.collector.service.translation.TranslationWorkerStats;

import java.util.Map;

public record CollectorStatusDTO(
        SchedulerStats scheduler,
        TranslationWorkerStats translation,
        Map<TranslationStatus, Long> articlesByTranslationStatus
) {
    public CollectorStatusDTO {
        articlesByTranslationStatus = articlesByTranslationStatus == null
                ? Map.of()
                : Map.copyOf(articlesByTranslationStatus);
    }
}
