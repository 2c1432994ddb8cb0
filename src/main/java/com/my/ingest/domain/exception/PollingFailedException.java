package com.my.ingest.domain.exception;

import com.my.ingest.domain.model.ErrorKind;

/**
 * 왜: 첫 폴링에 도달하기 전에 세션이 오류 상태가 된 경우 start() 호출자에게 분류된 원인을 전달하기 위함.
 */
public class PollingFailedException extends RuntimeException {

    private final String accountId;
    private final ErrorKind kind;

    public PollingFailedException(String accountId, ErrorKind kind, Throwable cause) {
        super("계정 폴링 실패: account=" + accountId + ", kind=" + kind, cause);
        this.accountId = accountId;
        this.kind = kind;
    }

    public String accountId() {
        return accountId;
    }

    public ErrorKind kind() {
        return kind;
    }
}
