package com.cryptosignal.collector.dto;

public record TierLimitDTO(
        String tier,
        int requestsPerMinute,
        int requestsPerDay
) {
}
