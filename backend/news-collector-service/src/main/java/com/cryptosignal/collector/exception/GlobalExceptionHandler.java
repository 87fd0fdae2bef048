package com.cryptosignal.collector.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 컨트롤러 전역 예외 핸들러. 예상하지 못한 오류는 모두 500 응답으로 변환한다.
 */
@RestControllerAdvice(basePackages = "com.cryptosignal.collector.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(SourceListingException.class)
    public ResponseEntity<Map<String, Object>> handleSourceListing(SourceListingException ex) {
        log.error("Source listing failed: {}", ex.getMessage(), ex);
        return build(ex.getErrorCode(), ex.getMessage(), HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(CollectorException.class)
    public ResponseEntity<Map<String, Object>> handleCollectorException(CollectorException ex) {
        log.error("Collector error: {}", ex.getMessage(), ex);
        return build(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return build("INVALID_REQUEST", ex.getMessage(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return build("INTERNAL_ERROR", "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Map<String, Object>> build(String errorCode, String message, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
