package com.cryptosignal.collector.controller;

import com.cryptosignal.collector.config.RateLimitProperties.TierLimit;
import com.cryptosignal.collector.ratelimit.RateLimitTier;
import com.cryptosignal.collector.ratelimit.RateLimitUsage;
import com.cryptosignal.collector.ratelimit.SlidingWindowRateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumMap;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * RateLimitController 단위 테스트
 */
@WebMvcTest(RateLimitController.class)
@ActiveProfiles("test")
class RateLimitControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SlidingWindowRateLimiter rateLimiter;

    @Test
    @DisplayName("GET /api/v1/rate-limit/usage - 사용자 헤더 기준 사용량")
    void usageForIdentifiedUser() throws Exception {
        // given
        when(rateLimiter.getUsage("user:42", RateLimitTier.PRO)).thenReturn(
                new RateLimitUsage("user:42", "pro", 3, 60, 57, 120, 10000, 9880, null));

        // when & then
        mockMvc.perform(get("/api/v1/rate-limit/usage")
                        .header("X-User-Id", "42")
                        .header("X-User-Tier", "pro"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identifier").value("user:42"))
                .andExpect(jsonPath("$.remainingThisMinute").value(57))
                .andExpect(jsonPath("$.storeUnavailable").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/v1/rate-limit/usage - 익명 요청은 IP 기준")
    void usageForAnonymousCaller() throws Exception {
        // given
        when(rateLimiter.getUsage("ip:203.0.113.9", RateLimitTier.ANONYMOUS)).thenReturn(
                new RateLimitUsage("ip:203.0.113.9", "anonymous", 0, 5, 5, 0, 100, 100, Boolean.TRUE));

        // when & then
        mockMvc.perform(get("/api/v1/rate-limit/usage")
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("anonymous"))
                .andExpect(jsonPath("$.storeUnavailable").value(true));
    }

    @Test
    @DisplayName("GET /api/v1/rate-limit/tiers - 등급별 한도")
    void listsTiers() throws Exception {
        // given
        Map<RateLimitTier, TierLimit> limits = new EnumMap<>(RateLimitTier.class);
        limits.put(RateLimitTier.ANONYMOUS, new TierLimit(5, 100));
        limits.put(RateLimitTier.ENTERPRISE, new TierLimit(300, -1));
        when(rateLimiter.getLimits()).thenReturn(limits);

        // when & then
        mockMvc.perform(get("/api/v1/rate-limit/tiers"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].tier").value("anonymous"))
                .andExpect(jsonPath("$[0].requestsPerMinute").value(5))
                .andExpect(jsonPath("$[1].tier").value("enterprise"))
                .andExpect(jsonPath("$[1].requestsPerDay").value(-1));
    }
}
