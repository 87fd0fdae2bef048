package com.cryptosignal.collector.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "articles",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_articles_source_guid", columnNames = {"source_id", "guid"})
    },
    indexes = {
        @Index(name = "idx_articles_pub_date", columnList = "pub_date"),
        @Index(name = "idx_articles_translation_status", columnList = "translation_status"),
        @Index(name = "idx_articles_is_breaking", columnList = "is_breaking")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "guid", nullable = false, columnDefinition = "TEXT")
    private String guid;

    @Column(name = "title", nullable = false, columnDefinition = "TEXT")
    private String title;

    @Column(name = "link", columnDefinition = "TEXT")
    private String link;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "pub_date", nullable = false)
    private Instant pubDate;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "categories", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> categories = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "mentioned_coins", columnDefinition = "jsonb")
    @Builder.Default
    private List<String> mentionedCoins = new ArrayList<>();

    @Column(name = "is_breaking", nullable = false)
    private boolean breaking;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // 번역 전 원문 (번역 대상일 때만 채워짐)
    @Column(name = "original_title", columnDefinition = "TEXT")
    private String originalTitle;

    @Column(name = "original_description", columnDefinition = "TEXT")
    private String originalDescription;

    @Column(name = "original_language", length = 10)
    private String originalLanguage;

    @Enumerated(EnumType.STRING)
    @Column(name = "translation_status", nullable = false, length = 20)
    @Builder.Default
    private TranslationStatus translationStatus = TranslationStatus.NONE;

    /**
     * Keeps the current title/description as originals and queues the article for translation.
     */
    public void markForTranslation(String language) {
        this.originalTitle = title;
        this.originalDescription = description;
        this.originalLanguage = language;
        this.translationStatus = TranslationStatus.PENDING;
    }

    public void setCategories(List<String> categories) {
        this.categories = categories != null ? new ArrayList<>(categories) : new ArrayList<>();
    }

    public void setMentionedCoins(List<String> mentionedCoins) {
        this.mentionedCoins = mentionedCoins != null ? new ArrayList<>(mentionedCoins) : new ArrayList<>();
    }
}
