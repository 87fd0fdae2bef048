package com.cryptosignal.collector.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 번역 워커 설정 (collector.translation.*)
 */
@ConfigurationProperties(prefix = "collector.translation")
@Validated
@Data
public class TranslationProperties {

    private boolean enabled = true;

    /**
     * Language articles are translated into. Blank disables translation marking at ingestion.
     */
    private String targetLanguage = "en";

    @NotNull
    private Duration interval = Duration.ofSeconds(30);

    @Min(1)
    private int batchSize = 5;

    /**
     * Delay between consecutive translation calls inside one batch
     */
    private Duration pacing = Duration.ofMillis(500);

    private String model = "llama-3.1-8b-instant";
}
