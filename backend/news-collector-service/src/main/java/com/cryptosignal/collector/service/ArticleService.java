package com.cryptosignal.collector.service;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.TranslationStatus;
import com.cryptosignal.collector.repository.ArticleRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Article persistence used by the fetch pipeline and the translation worker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleService {

    static final int INSERT_BATCH_SIZE = 100;

    private final ArticleRepository articleRepository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Inserts articles in batches of {@value #INSERT_BATCH_SIZE}, each batch in its own transaction.
     * Rows that already exist for the same (source, GUID) are skipped. A failing batch is logged
     * and the remaining batches are still attempted.
     *
     * @return number of rows actually inserted
     */
    public int bulkInsertArticles(List<Article> articles) {
        if (articles == null || articles.isEmpty()) {
            return 0;
        }

        int inserted = 0;
        for (int start = 0; start < articles.size(); start += INSERT_BATCH_SIZE) {
            List<Article> batch = articles.subList(start, Math.min(start + INSERT_BATCH_SIZE, articles.size()));
            try {
                Integer count = transactionTemplate.execute(status -> insertBatch(batch));
                inserted += count != null ? count : 0;
            } catch (RuntimeException e) {
                log.error("Failed to insert article batch {}-{}: {}",
                        start, start + batch.size() - 1, e.getMessage(), e);
            }
        }
        return inserted;
    }

    private int insertBatch(List<Article> batch) {
        int inserted = 0;
        for (Article article : batch) {
            inserted += articleRepository.insertIgnoringConflict(
                    article.getSourceId(),
                    article.getGuid(),
                    stripNul(article.getTitle()),
                    article.getLink(),
                    stripNul(article.getDescription()),
                    article.getPubDate(),
                    toJson(article.getCategories()),
                    toJson(article.getMentionedCoins()),
                    article.isBreaking(),
                    article.getCreatedAt(),
                    stripNul(article.getOriginalTitle()),
                    stripNul(article.getOriginalDescription()),
                    article.getOriginalLanguage(),
                    article.getTranslationStatus().name());
        }
        return inserted;
    }

    @Transactional(readOnly = true)
    public List<Article> getPendingTranslations(int limit) {
        return articleRepository.findPendingTranslations(limit > 0 ? limit : 10);
    }

    @Transactional
    public void updateTranslation(Long articleId, String title, String description, TranslationStatus status) {
        articleRepository.updateTranslation(articleId, stripNul(title), stripNul(description), status);
    }

    /**
     * 번역 상태별 기사 수
     */
    @Transactional(readOnly = true)
    public Map<TranslationStatus, Long> countByTranslationStatus() {
        Map<TranslationStatus, Long> counts = new EnumMap<>(TranslationStatus.class);
        for (TranslationStatus status : TranslationStatus.values()) {
            counts.put(status, articleRepository.countByTranslationStatus(status));
        }
        return counts;
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values != null ? values : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize list column", e);
        }
    }

    private static String stripNul(String text) {
        return text == null ? null : text.replace("\u0000", "");
    }
}
