package com.cryptosignal.collector.repository;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.NewsSource;
import com.cryptosignal.collector.entity.TranslationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ArticleRepository 통합 테스트 (Testcontainers 사용)
 * ON CONFLICT, jsonb 캐스팅 등 PostgreSQL 전용 쿼리를 실제 컨테이너에서 검증합니다.
 */
@DataJpaTest
@Testcontainers
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class ArticleRepositoryIT {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    private static final Instant PUB_DATE = Instant.parse("2026-01-15T10:00:00Z");

    @Autowired
    private ArticleRepository articleRepository;

    @Autowired
    private NewsSourceRepository newsSourceRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("동일 (source_id, guid) 재삽입은 무시되고 0을 반환")
    void insertIgnoresDuplicateGuidPerSource() {
        // given
        int first = insert(1L, "guid-1", "Bitcoin rallies", TranslationStatus.NONE);

        // when
        int duplicate = insert(1L, "guid-1", "Bitcoin rallies again", TranslationStatus.NONE);
        int otherSource = insert(2L, "guid-1", "Same guid, other source", TranslationStatus.NONE);

        // then
        assertThat(first).isEqualTo(1);
        assertThat(duplicate).isZero();
        assertThat(otherSource).isEqualTo(1);
        assertThat(articleRepository.count()).isEqualTo(2);
        assertThat(articleRepository.existsBySourceIdAndGuid(1L, "guid-1")).isTrue();
    }

    @Test
    @DisplayName("jsonb 컬럼이 리스트로 다시 읽힌다")
    void readsJsonColumnsBack() {
        // given
        insert(1L, "guid-json", "ETH upgrade", TranslationStatus.NONE);
        entityManager.clear();

        // when
        Article article = articleRepository.findAll().get(0);

        // then
        assertThat(article.getCategories()).containsExactly("market");
        assertThat(article.getMentionedCoins()).containsExactly("BTC", "ETH");
        assertThat(article.isBreaking()).isTrue();
        assertThat(article.getPubDate()).isEqualTo(PUB_DATE);
    }

    @Test
    @DisplayName("번역 대기 조회는 PENDING 먼저, 그다음 FAILED, 각각 id 순")
    void findPendingTranslationsOrdersPendingFirst() {
        // given
        insert(1L, "f1", "failed one", TranslationStatus.FAILED);
        insert(1L, "p1", "pending one", TranslationStatus.PENDING);
        insert(1L, "n1", "no translation", TranslationStatus.NONE);
        insert(1L, "p2", "pending two", TranslationStatus.PENDING);
        insert(1L, "c1", "completed", TranslationStatus.COMPLETED);

        // when
        List<Article> pending = articleRepository.findPendingTranslations(10);
        List<Article> limited = articleRepository.findPendingTranslations(2);

        // then
        assertThat(pending).extracting(Article::getGuid).containsExactly("p1", "p2", "f1");
        assertThat(limited).extracting(Article::getGuid).containsExactly("p1", "p2");
    }

    @Test
    @DisplayName("번역 결과 반영 후 상태와 본문이 갱신된다")
    void updateTranslationWritesTitleAndStatus() {
        // given
        insert(1L, "ko-1", "비트코인 급등", TranslationStatus.PENDING);
        Long id = articleRepository.findPendingTranslations(1).get(0).getId();

        // when
        int updated = articleRepository.updateTranslation(id, "Bitcoin surges", "translated body",
                TranslationStatus.COMPLETED);
        entityManager.clear();

        // then
        Article article = articleRepository.findById(id).orElseThrow();
        assertThat(updated).isEqualTo(1);
        assertThat(article.getTitle()).isEqualTo("Bitcoin surges");
        assertThat(article.getDescription()).isEqualTo("translated body");
        assertThat(article.getOriginalTitle()).isEqualTo("비트코인 급등");
        assertThat(article.getTranslationStatus()).isEqualTo(TranslationStatus.COMPLETED);
        assertThat(articleRepository.countByTranslationStatus(TranslationStatus.PENDING)).isZero();
        assertThat(articleRepository.countByTranslationStatus(TranslationStatus.COMPLETED)).isEqualTo(1);
    }

    @Test
    @DisplayName("소스 상태 카운터 갱신")
    void sourceErrorCounterUpdates() {
        // given
        NewsSource source = newsSourceRepository.save(NewsSource.builder()
                .key("coindesk")
                .name("CoinDesk")
                .rssUrl("https://www.coindesk.com/arc/outboundfeeds/rss/")
                .category("general")
                .build());
        Instant fetchedAt = Instant.now().truncatedTo(ChronoUnit.MICROS);

        // when
        newsSourceRepository.incrementErrorCount(source.getId());
        newsSourceRepository.incrementErrorCount(source.getId());
        newsSourceRepository.updateLastFetch(source.getId(), fetchedAt);
        entityManager.clear();
        NewsSource afterErrors = newsSourceRepository.findByKey("coindesk").orElseThrow();

        newsSourceRepository.resetErrorCount(source.getId());
        entityManager.clear();
        NewsSource afterReset = newsSourceRepository.findById(source.getId()).orElseThrow();

        // then
        assertThat(afterErrors.getErrorCount()).isEqualTo(2);
        assertThat(afterErrors.getLastFetchAt()).isEqualTo(fetchedAt);
        assertThat(afterReset.getErrorCount()).isZero();
        assertThat(newsSourceRepository.findByEnabledTrueOrderByIdAsc()).hasSize(1);
    }

    private int insert(Long sourceId, String guid, String title, TranslationStatus status) {
        return articleRepository.insertIgnoringConflict(
                sourceId, guid, title,
                "https://news.example.com/" + guid,
                "description of " + guid,
                PUB_DATE,
                "[\"market\"]",
                "[\"BTC\",\"ETH\"]",
                true,
                PUB_DATE.plusSeconds(60),
                title,
                "description of " + guid,
                status == TranslationStatus.NONE ? "en" : "ko",
                status.name());
    }
}
