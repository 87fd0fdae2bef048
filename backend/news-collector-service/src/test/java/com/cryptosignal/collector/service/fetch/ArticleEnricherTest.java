package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleEnricherTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ArticleEnricher enricher;

    @BeforeEach
    void setUp() {
        enricher = new ArticleEnricher(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("코인 이름과 심볼을 단어 단위로 추출")
    void extractsMentionedCoins() {
        assertThat(enricher.extractMentionedCoins("Bitcoin and ETH rally"))
                .containsExactly("BTC", "ETH");
    }

    @Test
    @DisplayName("알려진 코인이 없으면 빈 리스트 (null 아님)")
    void returnsEmptyListWhenNoCoins() {
        List<String> coins = enricher.extractMentionedCoins("The weather stayed calm across markets today");

        assertThat(coins).isNotNull().isEmpty();
        assertThat(enricher.extractMentionedCoins(null)).isNotNull().isEmpty();
    }

    @Test
    @DisplayName("단어 일부에 포함된 심볼은 무시")
    void ignoresPartialWordMatches() {
        assertThat(enricher.extractMentionedCoins("Solution architects discuss methods"))
                .isEmpty();
    }

    @Test
    @DisplayName("최근 2시간 내 기사는 속보")
    void recentArticleIsBreaking() {
        Article article = Article.builder()
                .title("Quiet market update")
                .pubDate(NOW.minus(Duration.ofMinutes(90)))
                .build();

        assertThat(enricher.isBreaking(article)).isTrue();
    }

    @Test
    @DisplayName("오래된 기사라도 제목에 속보 키워드가 있으면 속보")
    void keywordMakesArticleBreaking() {
        Article old = Article.builder()
                .title("JUST IN: exchange halts withdrawals")
                .pubDate(NOW.minus(Duration.ofDays(1)))
                .build();
        Article plain = Article.builder()
                .title("Weekly recap")
                .pubDate(NOW.minus(Duration.ofDays(1)))
                .build();

        assertThat(enricher.isBreaking(old)).isTrue();
        assertThat(enricher.isBreaking(plain)).isFalse();
    }

    @Test
    @DisplayName("같은 시각에 반복 판정해도 결과가 같음")
    void breakingCheckIsIdempotent() {
        Article article = Article.builder()
                .title("Weekly recap")
                .pubDate(NOW.minus(Duration.ofHours(2)))
                .build();

        boolean first = enricher.isBreaking(article);
        boolean second = enricher.isBreaking(article);

        assertThat(first).isEqualTo(second).isFalse();
    }

    @Test
    @DisplayName("카테고리: 소스 카테고리 우선, 없으면 키워드, 그것도 없으면 general")
    void detectsCategory() {
        assertThat(enricher.detectCategory("SEC files lawsuit", "bitcoin")).isEqualTo("bitcoin");
        assertThat(enricher.detectCategory("SEC files lawsuit against issuer", null)).isEqualTo("regulation");
        assertThat(enricher.detectCategory("Nothing to see here", "")).isEqualTo("general");
    }

    @Test
    @DisplayName("GUID 생성은 결정적이며 gen- 접두사를 가짐")
    void generatesDeterministicGuid() {
        Article article = Article.builder().sourceId(7L).link("https://example.com/a").title("Title").build();

        String first = enricher.generateGuid(article);
        String second = enricher.generateGuid(article);

        assertThat(first).isEqualTo(second).startsWith("gen-").hasSize(4 + 32);
    }

    @Test
    @DisplayName("enrich 는 비어 있는 카테고리와 GUID만 채움")
    void enrichFillsMissingFields() {
        Article withCategories = Article.builder()
                .sourceId(1L)
                .guid("guid-1")
                .title("Solana breaks out")
                .pubDate(NOW.minus(Duration.ofDays(2)))
                .build();
        withCategories.setCategories(List.of("altcoins"));

        Article bare = Article.builder()
                .sourceId(1L)
                .title("Ethereum staking update")
                .link("https://example.com/eth")
                .pubDate(NOW.minus(Duration.ofDays(2)))
                .build();

        enricher.enrich(withCategories, "news");
        enricher.enrich(bare, null);

        assertThat(withCategories.getCategories()).containsExactly("altcoins");
        assertThat(withCategories.getGuid()).isEqualTo("guid-1");
        assertThat(withCategories.getMentionedCoins()).containsExactly("SOL");
        assertThat(withCategories.isBreaking()).isFalse();

        assertThat(bare.getCategories()).containsExactly("staking");
        assertThat(bare.getGuid()).startsWith("gen-");
        assertThat(bare.getMentionedCoins()).containsExactly("ETH");
    }
}
