package com.cryptosignal.collector.service.fetch;

import com.cryptosignal.collector.entity.Article;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 워커 결과를 합치고 GUID 기준으로 중복을 제거한다.
 */
public class BatchProcessor {

    public record Collected(List<Article> articles, List<FetchJobResult> failures) {
    }

    /**
     * Articles of successful jobs in job order, and the failed job results.
     */
    public Collected collect(List<FetchJobResult> results) {
        List<Article> articles = new ArrayList<>();
        List<FetchJobResult> failures = new ArrayList<>();
        for (FetchJobResult result : results) {
            if (result.isSuccess()) {
                articles.addAll(result.articles());
            } else {
                failures.add(result);
            }
        }
        return new Collected(articles, failures);
    }

    /**
     * First occurrence of each GUID wins, across all sources.
     */
    public List<Article> deduplicate(List<Article> articles) {
        Set<String> seen = new HashSet<>(articles.size() * 2);
        List<Article> unique = new ArrayList<>(articles.size());
        for (Article article : articles) {
            if (seen.add(article.getGuid())) {
                unique.add(article);
            }
        }
        return unique;
    }
}
