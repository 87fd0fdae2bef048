package com.cryptosignal.collector.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * /api/** 요청마다 Rate Limit 을 판정하고 X-RateLimit-* 헤더를 설정한다.
 * 한도 초과 시 다음 필터로 넘기지 않고 429 를 응답한다.
 */
@Slf4j
public class RateLimitFilter extends OncePerRequestFilter {

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";

    private final SlidingWindowRateLimiter rateLimiter;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(SlidingWindowRateLimiter rateLimiter, ObjectMapper objectMapper) {
        this.rateLimiter = rateLimiter;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        CallerIdentity caller = CallerIdentity.from(request);
        RateLimitDecision decision = rateLimiter.check(caller.identifier(), caller.tier());

        response.setHeader(HEADER_LIMIT, Integer.toString(decision.limit()));
        response.setHeader(HEADER_REMAINING, Long.toString(decision.remaining()));
        response.setHeader(HEADER_RESET, Long.toString(decision.resetAt()));

        if (!decision.allowed()) {
            log.info("Rejected request over quota: caller={}, tier={}, path={}",
                    caller.identifier(), caller.tier().getValue(), request.getRequestURI());
            writeRejection(response, decision);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void writeRejection(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "rate_limit_exceeded");
        body.put("message", "You have exceeded your rate limit. Please try again later.");
        body.put("retry_after", decision.retryAfterSeconds());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", Long.toString(decision.retryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
