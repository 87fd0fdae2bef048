package com.cryptosignal.collector.repository;

import com.cryptosignal.collector.entity.NewsSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface NewsSourceRepository extends JpaRepository<NewsSource, Long> {

    List<NewsSource> findByEnabledTrueOrderByIdAsc();

    Optional<NewsSource> findByKey(String key);

    boolean existsByKey(String key);

    @Modifying
    @Query("UPDATE NewsSource s SET s.errorCount = s.errorCount + 1 WHERE s.id = :id")
    int incrementErrorCount(@Param("id") Long id);

    @Modifying
    @Query("UPDATE NewsSource s SET s.errorCount = 0 WHERE s.id = :id")
    int resetErrorCount(@Param("id") Long id);

    @Modifying
    @Query("UPDATE NewsSource s SET s.lastFetchAt = :fetchedAt WHERE s.id = :id")
    int updateLastFetch(@Param("id") Long id, @Param("fetchedAt") Instant fetchedAt);
}
