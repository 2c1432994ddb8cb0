package com.my.ingest.domain.exception;

/**
 * 왜: 커서 저장소 장애를 다른 예외와 구분해 재시도 대상으로 분류하기 위함.
 */
public class OffsetStoreException extends IllegalStateException {
    public OffsetStoreException(String message) {
        super(message);
    }

    public OffsetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
