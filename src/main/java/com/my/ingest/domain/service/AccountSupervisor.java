package com.my.ingest.domain.service;

import com.my.ingest.domain.exception.InvalidStateException;
import com.my.ingest.domain.model.SessionState;
import com.my.ingest.domain.model.SessionStatus;
import com.my.ingest.domain.port.in.AccountPollingUseCase;
import com.my.ingest.domain.port.out.EventProcessorPort;
import com.my.ingest.domain.port.out.PollingErrorListener;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 왜: 계정마다 독립된 폴링 세션을 소유해 한 계정의 장애나 취소가 다른 계정에 번지지 않게 하기 위함.
 */
public class AccountSupervisor implements AccountPollingUseCase {

    private static final Logger log = Logger.getLogger(AccountSupervisor.class);

    private final Map<String, PollingClient> clients;

    public AccountSupervisor(Collection<PollingClient> clients) {
        Map<String, PollingClient> byAccount = new LinkedHashMap<>();
        for (PollingClient client : clients) {
            if (byAccount.putIfAbsent(client.accountId(), client) != null) {
                throw new IllegalArgumentException("중복된 계정입니다: " + client.accountId());
            }
        }
        this.clients = Collections.unmodifiableMap(byAccount);
    }

    public void onEvent(EventProcessorPort processor) {
        clients.values().forEach(client -> client.onEvent(processor));
    }

    public void onError(PollingErrorListener listener) {
        clients.values().forEach(client -> client.onError(listener));
    }

    @Override
    public CompletableFuture<Map<String, SessionState>> start() {
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        clients.forEach((accountId, client) -> pending.add(startAccount(accountId, client)));
        return CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> status());
    }

    private CompletableFuture<Void> startAccount(String accountId, PollingClient client) {
        CompletableFuture<Void> started;
        try {
            started = client.start();
        } catch (InvalidStateException e) {
            log.warnf("이미 시작된 계정입니다: account=%s state=%s", accountId, e.currentState());
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            started = CompletableFuture.failedFuture(e);
        }
        return started.handle((ignored, error) -> {
            if (error != null) {
                log.errorf("계정 폴링을 시작하지 못했습니다: account=%s cause=%s", accountId, error.getMessage());
            } else {
                log.infof("계정 폴링 시작: account=%s", accountId);
            }
            return null;
        });
    }

    /**
     * 모든 세션에 정지 신호를 먼저 보낸 뒤 각 세션이 STOPPED 가 될 때까지 기다린다.
     */
    @Override
    public void stop() {
        clients.values().forEach(PollingClient::requestStop);
        clients.values().forEach(PollingClient::awaitStopped);
        log.infof("모든 계정 폴링을 정지했습니다: accounts=%d", clients.size());
    }

    @Override
    public boolean pause(String accountId) {
        return client(accountId).pause();
    }

    @Override
    public boolean resume(String accountId) {
        return client(accountId).resume();
    }

    @Override
    public void resetCursor(String accountId) {
        client(accountId).resetCursor();
    }

    @Override
    public Map<String, SessionState> status() {
        Map<String, SessionState> status = new LinkedHashMap<>();
        clients.forEach((accountId, client) -> status.put(accountId, client.state()));
        return status;
    }

    @Override
    public List<SessionStatus> snapshots() {
        return clients.values().stream()
                .map(PollingClient::status)
                .toList();
    }

    /**
     * 설정된 모든 계정이 POLLING 또는 PAUSED 이면 정상이다.
     */
    @Override
    public boolean isHealthy() {
        return clients.values().stream()
                .allMatch(client -> client.state().isHealthy());
    }

    private PollingClient client(String accountId) {
        PollingClient client = clients.get(accountId);
        if (client == null) {
            throw new IllegalArgumentException("알 수 없는 계정입니다: " + accountId);
        }
        return client;
    }
}
