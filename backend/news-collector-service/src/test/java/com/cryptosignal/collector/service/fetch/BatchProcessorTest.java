package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.exception.FeedFetchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchProcessorTest {

    private final BatchProcessor batchProcessor = new BatchProcessor();

    @Test
    @DisplayName("성공 결과의 기사와 실패 결과를 분리")
    void separatesArticlesAndFailures() {
        // given
        FetchJobResult ok = new FetchJobResult(1L, "a", List.of(article(1L, "g1"), article(1L, "g2")),
                Duration.ofMillis(10), null, 0);
        FetchJobResult failed = new FetchJobResult(2L, "b", List.of(), Duration.ofMillis(20),
                new FeedFetchException("https://b", 500), 2);

        // when
        BatchProcessor.Collected collected = batchProcessor.collect(List.of(ok, failed));

        // then
        assertThat(collected.articles()).extracting(Article::getGuid).containsExactly("g1", "g2");
        assertThat(collected.failures()).containsExactly(failed);
    }

    @Test
    @DisplayName("GUID 중복은 소스와 무관하게 첫 번째만 유지")
    void deduplicatesByGuidFirstWins() {
        // given
        Article first = article(1L, "shared");
        Article duplicateSameSource = article(1L, "shared");
        Article duplicateOtherSource = article(2L, "shared");
        Article other = article(2L, "unique");

        // when
        List<Article> unique = batchProcessor.deduplicate(
                List.of(first, duplicateSameSource, other, duplicateOtherSource));

        // then
        assertThat(unique).containsExactly(first, other);
        assertThat(unique.get(0).getSourceId()).isEqualTo(1L);
    }

    private static Article article(Long sourceId, String guid) {
        return Article.builder().sourceId(sourceId).guid(guid).title(guid).build();
    }
}
