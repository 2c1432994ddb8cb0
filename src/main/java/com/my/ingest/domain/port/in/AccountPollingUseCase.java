package com.my.ingest.domain.port.in;

import com.my.ingest.domain.model.SessionState;
import com.my.ingest.domain.model.SessionStatus;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 왜: 설정된 모든 계정의 폴링 세션을 하나의 진입점으로 기동/정지/조회하기 위함.
 */
public interface AccountPollingUseCase {

    /**
     * 모든 계정을 독립적으로 시작한다. 반환된 Future는 모든 계정이 폴링에 도달하거나 실패했을 때 완료된다.
     */
    CompletableFuture<Map<String, SessionState>> start();

    void stop();

    boolean pause(String accountId);

    boolean resume(String accountId);

    void resetCursor(String accountId);

    Map<String, SessionState> status();

    List<SessionStatus> snapshots();

    boolean isHealthy();
}
