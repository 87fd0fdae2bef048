package com.cryptosignal.collector.controller;

import com.cryptosignal.collector.dto.CollectorStatusDTO;
import com.cryptosignal.collector.scheduler.FeedFetchScheduler;
import com.cryptosignal.collector.service.ArticleService;
import com.cryptosignal.collector.service.fetch.FetchResult;
import com.cryptosignal.collector.service.translation.TranslationWorker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
@Slf4j
public class StatusController {

    private final FeedFetchScheduler feedFetchScheduler;
    private final TranslationWorker translationWorker;
    private final ArticleService articleService;

    /**
     * GET /api/v1/status - 스케줄러, 번역 워커, 번역 상태별 기사 수
     */
    @GetMapping
    public ResponseEntity<CollectorStatusDTO> getStatus() {
        return ResponseEntity.ok(new CollectorStatusDTO(
                feedFetchScheduler.getStats(),
                translationWorker.getStats(),
                articleService.countByTranslationStatus()
        ));
    }

    /**
     * POST /api/v1/status/fetch - 수집 주기 1회 즉시 실행 (완료까지 대기)
     */
    @PostMapping("/fetch")
    public ResponseEntity<FetchResult> triggerFetch() {
        log.info("Manual fetch cycle requested");
        return ResponseEntity.ok(feedFetchScheduler.runOnce());
    }
}
