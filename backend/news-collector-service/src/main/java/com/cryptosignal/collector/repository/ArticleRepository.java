package com.cryptosignal.collector.repository;

import com.cryptosignal.collector.entity.Article;
import com.cryptosignal.collector.entity.TranslationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    /**
     * (source_id, guid) 충돌 시 아무것도 하지 않음. 반환값은 실제로 삽입된 행 수 (0 또는 1).
     */
    @Modifying
    @Query(value = "INSERT INTO articles (source_id, guid, title, link, description, pub_date, " +
            "categories, mentioned_coins, is_breaking, created_at, " +
            "original_title, original_description, original_language, translation_status) " +
            "VALUES (:sourceId, :guid, :title, :link, :description, :pubDate, " +
            "CAST(:categories AS jsonb), CAST(:mentionedCoins AS jsonb), :breaking, :createdAt, " +
            ":originalTitle, :originalDescription, :originalLanguage, :translationStatus) " +
            "ON CONFLICT (source_id, guid) DO NOTHING",
            nativeQuery = true)
    int insertIgnoringConflict(@Param("sourceId") Long sourceId,
                               @Param("guid") String guid,
                               @Param("title") String title,
                               @Param("link") String link,
                               @Param("description") String description,
                               @Param("pubDate") Instant pubDate,
                               @Param("categories") String categoriesJson,
                               @Param("mentionedCoins") String mentionedCoinsJson,
                               @Param("breaking") boolean breaking,
                               @Param("createdAt") Instant createdAt,
                               @Param("originalTitle") String originalTitle,
                               @Param("originalDescription") String originalDescription,
                               @Param("originalLanguage") String originalLanguage,
                               @Param("translationStatus") String translationStatus);

    /**
     * 번역 대기(PENDING) 우선, 그다음 실패(FAILED) 건을 id 순으로 조회
     */
    @Query(value = "SELECT * FROM articles WHERE translation_status IN ('PENDING', 'FAILED') " +
            "ORDER BY CASE WHEN translation_status = 'PENDING' THEN 0 ELSE 1 END, id ASC " +
            "LIMIT :limit",
            nativeQuery = true)
    List<Article> findPendingTranslations(@Param("limit") int limit);

    @Modifying
    @Query("UPDATE Article a SET a.title = :title, a.description = :description, " +
           "a.translationStatus = :status WHERE a.id = :id")
    int updateTranslation(@Param("id") Long id,
                          @Param("title") String title,
                          @Param("description") String description,
                          @Param("status") TranslationStatus status);

    long countByTranslationStatus(TranslationStatus status);

    boolean existsBySourceIdAndGuid(Long sourceId, String guid);
}
