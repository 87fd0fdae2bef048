package com.cryptosignal.collector.entity;

public enum TranslationStatus {
    NONE,       // 번역 불필요 (대상 언어와 동일)
    PENDING,    // 번역 대기
    COMPLETED,  // 번역 완료
    FAILED      // 번역 실패, 이후 재시도 대상
}
