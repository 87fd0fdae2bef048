package com.cryptosignal.collector.client;

import com.cryptosignal.collector.config.GroqProperties;
import com.cryptosignal.collector.config.TranslationProperties;
import com.cryptosignal.collector.exception.TranslationApiException;
import com.cryptosignal.collector.service.translation.ArticleTranslator;
import com.cryptosignal.collector.service.translation.TranslationFailure;
import com.cryptosignal.collector.service.translation.TranslationOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groq (OpenAI 호환 chat completions) 기반 기사 번역 클라이언트.
 *
 * 429 는 재시도하지 않고 Retry-After 와 함께 실패로 돌려준다. 5xx 만 지수 백오프로 재시도.
 */
@Component
@Slf4j
public class GroqTranslationClient implements ArticleTranslator {

    static final int MAX_DESCRIPTION_CHARS = 2000;
    static final double TEMPERATURE = 0.3;
    static final int MAX_TOKENS = 1024;

    private static final String SYSTEM_PROMPT = "You are a professional translator specializing in cryptocurrency "
            + "and financial news. Translate accurately while preserving technical terms and coin names. "
            + "Respond ONLY with valid JSON.";

    private static final String USER_PROMPT = """
            Translate this %s cryptocurrency news article to %s. Return ONLY valid JSON with "title" and "description" fields.

            Title: %s

            Description: %s

            Response format:
            {"title": "translated title", "description": "translated description"}""";

    private static final Map<String, String> LANGUAGE_NAMES = Map.ofEntries(
            Map.entry("en", "English"),
            Map.entry("ko", "Korean"),
            Map.entry("zh", "Chinese"),
            Map.entry("ja", "Japanese"),
            Map.entry("es", "Spanish"),
            Map.entry("pt", "Portuguese"),
            Map.entry("de", "German"),
            Map.entry("fr", "French"),
            Map.entry("ru", "Russian"),
            Map.entry("tr", "Turkish"),
            Map.entry("it", "Italian"),
            Map.entry("nl", "Dutch"),
            Map.entry("pl", "Polish"),
            Map.entry("vi", "Vietnamese"),
            Map.entry("id", "Indonesian"),
            Map.entry("th", "Thai"),
            Map.entry("ar", "Arabic"),
            Map.entry("fa", "Persian"),
            Map.entry("uk", "Ukrainian"),
            Map.entry("ro", "Romanian"));

    private final WebClient webClient;
    private final GroqProperties groqProperties;
    private final TranslationProperties translationProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GroqTranslationClient(@Qualifier("groqWebClient") WebClient webClient,
                                 GroqProperties groqProperties,
                                 TranslationProperties translationProperties,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.webClient = webClient;
        this.groqProperties = groqProperties;
        this.translationProperties = translationProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public TranslationOutcome translate(String title, String description, String sourceLanguage) {
        String targetLanguage = translationProperties.getTargetLanguage();
        if (sourceLanguage == null || sourceLanguage.isBlank() || sourceLanguage.equalsIgnoreCase(targetLanguage)) {
            return TranslationOutcome.success(title, description);
        }
        if (!groqProperties.isConfigured()) {
            return TranslationOutcome.failure(TranslationFailure.of("Groq API key is not configured"));
        }

        Map<String, Object> body = Map.of(
                "model", translationProperties.getModel(),
                "temperature", TEMPERATURE,
                "max_tokens", MAX_TOKENS,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", buildPrompt(title, description, sourceLanguage, targetLanguage))
                )
        );

        try {
            String content = chat(body).block();
            return parseTranslation(content, title, description);
        } catch (TranslationApiException e) {
            return TranslationOutcome.failure(new TranslationFailure(e.getMessage(), e.getStatusCode(), e.getRetryAfter()));
        } catch (RuntimeException e) {
            log.debug("Translation request failed", e);
            return TranslationOutcome.failure(TranslationFailure.of("Translation request failed: " + e.getMessage()));
        }
    }

    String buildPrompt(String title, String description, String sourceLanguage, String targetLanguage) {
        String desc = description == null ? "" : description;
        if (desc.length() > MAX_DESCRIPTION_CHARS) {
            desc = desc.substring(0, MAX_DESCRIPTION_CHARS);
        }
        return String.format(USER_PROMPT, languageName(sourceLanguage), languageName(targetLanguage), title, desc);
    }

    static String languageName(String code) {
        if (code == null) {
            return "";
        }
        return LANGUAGE_NAMES.getOrDefault(code.toLowerCase(Locale.ROOT), code);
    }

    private Mono<String> chat(Map<String, Object> body) {
        return webClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + groqProperties.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToMono(JsonNode.class)
                .map(this::extractContent)
                .timeout(groqProperties.getTimeout())
                .retryWhen(Retry.backoff(groqProperties.getMaxRetries(), Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofSeconds(30))
                        .filter(e -> e instanceof TranslationApiException
                                && ((TranslationApiException) e).isServerError())
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private Mono<TranslationApiException> toApiException(ClientResponse response) {
        int status = response.statusCode().value();
        Duration retryAfter = parseRetryAfter(response.headers().asHttpHeaders().getFirst(HttpHeaders.RETRY_AFTER));
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(errorBody -> new TranslationApiException(status,
                        "Groq API error (status " + status + "): " + abbreviate(errorBody), retryAfter));
    }

    /**
     * Retry-After as delta-seconds or an HTTP date. Null when absent or unparsable.
     */
    Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        if (value.length() <= 9 && value.chars().allMatch(Character::isDigit)) {
            long seconds = Long.parseLong(value);
            return seconds > 0 ? Duration.ofSeconds(seconds) : null;
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(clock.instant(), at.toInstant());
            return until.isNegative() || until.isZero() ? null : until;
        } catch (DateTimeParseException e) {
            log.debug("Unparsable Retry-After header: {}", value);
            return null;
        }
    }

    private String extractContent(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new IllegalStateException("Groq response has no message content");
        }
        return content.asText();
    }

    /**
     * Parses the model's JSON reply. Falls back to the untranslated text when the reply is not usable JSON.
     */
    TranslationOutcome parseTranslation(String content, String originalTitle, String originalDescription) {
        String cleaned = stripCodeFence(content);
        JsonNode node = readJson(cleaned);
        if (node == null) {
            int start = cleaned.indexOf('{');
            int end = cleaned.lastIndexOf('}');
            if (start >= 0 && end > start) {
                node = readJson(cleaned.substring(start, end + 1));
            }
        }
        if (node == null) {
            log.warn("Failed to parse translation reply, keeping original text");
            return TranslationOutcome.success(originalTitle, originalDescription);
        }

        String title = node.path("title").asText("");
        String description = node.path("description").asText("");
        return TranslationOutcome.success(
                title.isBlank() ? originalTitle : title,
                description.isBlank() ? originalDescription : description);
    }

    /**
     * @return the parsed object, or null when the text is not a JSON object
     */
    private JsonNode readJson(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String text = content.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        return text.trim();
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
