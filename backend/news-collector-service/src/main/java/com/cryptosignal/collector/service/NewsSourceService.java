package com.cryptosignal.collector.service;

import com.cryptosignal.collector.entity.NewsSource;
import com.cryptosignal.collector.exception.SourceListingException;
import com.cryptosignal.collector.repository.NewsSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * 소스 조회 및 소스별 상태(오류 횟수, 마지막 수집 시각) 갱신
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NewsSourceService {

    private final NewsSourceRepository newsSourceRepository;

    /**
     * 활성화된 소스 목록 조회
     *
     * @throws SourceListingException 저장소 조회 실패 시
     */
    @Transactional(readOnly = true)
    public List<NewsSource> listEnabledSources() {
        try {
            return newsSourceRepository.findByEnabledTrueOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new SourceListingException("Failed to load enabled sources: " + e.getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public List<NewsSource> listAllSources() {
        return newsSourceRepository.findAll();
    }

    @Transactional
    public void incrementErrorCount(Long sourceId) {
        newsSourceRepository.incrementErrorCount(sourceId);
    }

    @Transactional
    public void resetErrorCount(Long sourceId) {
        newsSourceRepository.resetErrorCount(sourceId);
    }

    @Transactional
    public void updateLastFetch(Long sourceId, Instant fetchedAt) {
        newsSourceRepository.updateLastFetch(sourceId, fetchedAt);
    }
}
