package com.cryptosignal.collector.exception;

/**
 * 활성 소스 목록을 불러오지 못한 경우. 수집 주기 전체를 실패시키는 유일한 오류.
 */
public class SourceListingException extends CollectorException {

    public SourceListingException(String message, Throwable cause) {
        super("SOURCE_LISTING_FAILED", message, cause);
    }
}
