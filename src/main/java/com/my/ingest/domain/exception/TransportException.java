package com.my.ingest.domain.exception;

import com.my.ingest.domain.model.ErrorKind;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * 왜: 전송 계층 실패를 분류 정보와 함께 도메인으로 올려 재시도 여부를 판단할 수 있게 하기 위함.
 */
public class TransportException extends RuntimeException {

    private final ErrorKind kind;
    private final Duration retryAfter;

    public TransportException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public TransportException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, null);
    }

    public TransportException(ErrorKind kind, String message, Duration retryAfter) {
        this(kind, message, null, retryAfter);
    }

    private TransportException(ErrorKind kind, String message, Throwable cause, Duration retryAfter) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.retryAfter = retryAfter;
    }

    public ErrorKind kind() {
        return kind;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
