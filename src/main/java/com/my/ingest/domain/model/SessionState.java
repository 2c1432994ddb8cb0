package com.my.ingest.domain.model;

/**
 * 왜: 폴링 세션의 생명주기를 명시적 상태로 표현해 허용되지 않는 전이를 거부하기 위함.
 */
public enum SessionState {
    IDLE,
    CONNECTING,
    POLLING,
    PAUSED,
    ERROR,
    STOPPED;

    public boolean isHealthy() {
        return this == POLLING || this == PAUSED;
    }
}
