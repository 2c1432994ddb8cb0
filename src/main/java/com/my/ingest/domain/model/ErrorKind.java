package com.my.ingest.domain.model;

/**
 * 왜: 실패 원인을 재시도 가능 여부와 함께 분류해 백오프/종료 판단을 한 곳에서 하기 위함.
 */
public enum ErrorKind {
    NETWORK(true),
    RATE_LIMITED(true),
    SERVER(true),
    OFFSET_STORE(true),
    AUTH(false),
    MALFORMED_RESPONSE(false),
    UNEXPECTED(false),
    PROCESSING(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
