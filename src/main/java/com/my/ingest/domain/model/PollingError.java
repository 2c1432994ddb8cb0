package com.my.ingest.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 오류 콜백과 상태 조회에 같은 오류 정보를 전달해 운영자가 원인을 추적할 수 있게 하기 위함.
 *
 * <p>{@code eventId}는 이벤트 처리 실패일 때만 채워진다.
 */
public record PollingError(String accountId,
                           ErrorKind kind,
                           boolean terminal,
                           String eventId,
                           Throwable cause,
                           Instant occurredAt) {

    public PollingError {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(cause, "cause");
        Objects.requireNonNull(occurredAt, "occurredAt");
    }

    public static PollingError terminal(String accountId, ErrorKind kind, Throwable cause, Instant occurredAt) {
        return new PollingError(accountId, kind, true, null, cause, occurredAt);
    }

    public static PollingError processing(String accountId, String eventId, Throwable cause, Instant occurredAt) {
        return new PollingError(accountId, ErrorKind.PROCESSING, false, eventId, cause, occurredAt);
    }

    public String message() {
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
