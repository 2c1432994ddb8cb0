package com.my.ingest.domain.exception;

import com.my.ingest.domain.model.SessionState;

/**
 * 왜: 현재 세션 상태에서 허용되지 않는 생명주기 호출을 호출자에게 명확히 거부하기 위함.
 */
public class InvalidStateException extends RuntimeException {

    private final SessionState currentState;

    public InvalidStateException(String operation, SessionState currentState) {
        super(operation + "() 호출은 " + currentState + " 상태에서 허용되지 않습니다.");
        this.currentState = currentState;
    }

    public SessionState currentState() {
        return currentState;
    }
}
