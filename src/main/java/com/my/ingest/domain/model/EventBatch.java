package com.my.ingest.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * 왜: 한 번의 롱폴링 결과(이벤트 묶음과 다음 커서)를 함께 다뤄 커서가 이벤트보다 앞서 나가지 않게 하기 위함.
 */
public record EventBatch(List<RawEvent> events, Cursor nextCursor) {

    public EventBatch {
        Objects.requireNonNull(nextCursor, "nextCursor");
        events = List.copyOf(Objects.requireNonNull(events, "events"));
    }

    public static EventBatch empty(Cursor nextCursor) {
        return new EventBatch(List.of(), nextCursor);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
