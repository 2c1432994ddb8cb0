package com.my.ingest.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 파싱 전 원시 이벤트를 그대로 하위 디스패처에 넘기기 위해 최소 필드만 고정한다.
 *
 * <p>{@code payload}는 원본 JSON 텍스트이며 {@code occurredAt}은 플랫폼이 주지 않으면 null 이다.
 */
public record RawEvent(String eventId, String type, Instant occurredAt, String payload) {

    public RawEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (eventId.isBlank()) {
            throw new IllegalArgumentException("eventId는 비어 있을 수 없습니다.");
        }
    }
}
