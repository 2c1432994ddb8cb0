package com.my.ingest.adapter.in.lifecycle;

import com.my.ingest.domain.port.in.AccountPollingUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * 왜: 애플리케이션 기동/종료에 맞춰 모든 계정의 폴링 세션을 시작하고 정리하기 위함.
 */
@Startup
@ApplicationScoped
public class PollingLifecycle {

    private static final Logger log = Logger.getLogger(PollingLifecycle.class);

    private final AccountPollingUseCase accountPollingUseCase;

    @Inject
    public PollingLifecycle(AccountPollingUseCase accountPollingUseCase) {
        this.accountPollingUseCase = accountPollingUseCase;
    }

    @PostConstruct
    void start() {
        accountPollingUseCase.start()
                .thenAccept(status -> log.infof("계정 폴링 기동 결과: %s", status));
    }

    @PreDestroy
    void stop() {
        accountPollingUseCase.stop();
    }
}
