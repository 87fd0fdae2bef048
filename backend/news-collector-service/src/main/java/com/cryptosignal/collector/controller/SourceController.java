package com.cryptosignal.collector.controller;

import com.cryptosignal.collector.dto.SourceStatusDTO;
import com.cryptosignal.collector.service.NewsSourceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class SourceController {

    private final NewsSourceService newsSourceService;

    /**
     * GET /api/v1/sources - 등록된 소스와 상태
     */
    @GetMapping
    public ResponseEntity<List<SourceStatusDTO>> listSources() {
        List<SourceStatusDTO> sources = newsSourceService.listAllSources().stream()
                .map(SourceStatusDTO::from)
                .toList();
        return ResponseEntity.ok(sources);
    }
}
