package com.cryptosignal.collector.controller;

import com.cryptosignal.collector.dto.TierLimitDTO;
import com.cryptosignal.collector.ratelimit.CallerIdentity;
import com.cryptosignal.collector.ratelimit.RateLimitUsage;
import com.cryptosignal.collector.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rate-limit")
@RequiredArgsConstructor
public class RateLimitController {

    private final SlidingWindowRateLimiter rateLimiter;

    /**
     * GET /api/v1/rate-limit/usage - 호출자의 현재 사용량
     */
    @GetMapping("/usage")
    public ResponseEntity<RateLimitUsage> getUsage(HttpServletRequest request) {
        CallerIdentity caller = CallerIdentity.from(request);
        return ResponseEntity.ok(rateLimiter.getUsage(caller.identifier(), caller.tier()));
    }

    /**
     * GET /api/v1/rate-limit/tiers - 등급별 한도 (requestsPerDay -1 은 무제한)
     */
    @GetMapping("/tiers")
    public ResponseEntity<List<TierLimitDTO>> getTiers() {
        List<TierLimitDTO> tiers = rateLimiter.getLimits().entrySet().stream()
                .map(e -> new TierLimitDTO(
                        e.getKey().getValue(),
                        e.getValue().getRequestsPerMinute(),
                        e.getValue().getRequestsPerDay()))
                .toList();
        return ResponseEntity.ok(tiers);
    }
}
