package com.cryptosignal.collector.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@ConfigurationProperties(prefix = "collector.groq")
@Validated
@Data
public class GroqProperties {

    private String apiKey;

    private String baseUrl = "https://api.groq.com/openai/v1";

    private Duration timeout = Duration.ofSeconds(30);

    /**
     * Retries for 5xx responses only. 429 is reported to the caller immediately.
     */
    @Min(0)
    private int maxRetries = 3;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
