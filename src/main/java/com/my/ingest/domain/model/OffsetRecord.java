package com.my.ingest.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 계정별로 어디까지 처리했는지를 하나의 레코드로 영속화해 재시작 시 이어받기 위함.
 *
 * <p>{@code lastEventTime}은 아직 시간 정보가 있는 이벤트를 받지 못했다면 null 이다.
 */
public record OffsetRecord(String accountId, Cursor cursor, Instant lastEventTime, int schemaVersion) {

    public static final int SCHEMA_VERSION = 1;

    public OffsetRecord {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(cursor, "cursor");
        if (accountId.isBlank()) {
            throw new IllegalArgumentException("accountId는 비어 있을 수 없습니다.");
        }
    }

    public static OffsetRecord of(String accountId, Cursor cursor, Instant lastEventTime) {
        return new OffsetRecord(accountId, cursor, lastEventTime, SCHEMA_VERSION);
    }

    public boolean isCurrentSchema() {
        return schemaVersion == SCHEMA_VERSION;
    }
}
