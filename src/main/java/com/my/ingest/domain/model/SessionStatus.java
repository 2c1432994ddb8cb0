package com.my.ingest.domain.model;

import java.util.Optional;

/**
 * 왜: 헬스 체크와 운영 조회에 세션의 현재 모습을 한 번에 넘기기 위함.
 */
public record SessionStatus(String accountId, SessionState state, Cursor cursor, int attempts, PollingError lastError) {

    public Optional<Cursor> currentCursor() {
        return Optional.ofNullable(cursor);
    }

    public Optional<PollingError> lastReportedError() {
        return Optional.ofNullable(lastError);
    }
}
