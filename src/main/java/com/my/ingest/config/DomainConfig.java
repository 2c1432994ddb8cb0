package com.my.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.ingest.adapter.out.clock.SystemClockAdapter;
import com.my.ingest.adapter.out.transport.HttpFetchTransport;
import com.my.ingest.adapter.out.transport.StaticCredentialProvider;
import com.my.ingest.adapter.out.transport.TokenExchangeCredentialProvider;
import com.my.ingest.domain.model.PollingOptions;
import com.my.ingest.domain.model.RetryPolicy;
import com.my.ingest.domain.port.in.AccountPollingUseCase;
import com.my.ingest.domain.port.out.ClockPort;
import com.my.ingest.domain.port.out.CredentialPort;
import com.my.ingest.domain.port.out.EventProcessorPort;
import com.my.ingest.domain.port.out.OffsetStorePort;
import com.my.ingest.domain.port.out.PollingErrorListener;
import com.my.ingest.domain.service.AccountSupervisor;
import com.my.ingest.domain.service.BackoffPolicy;
import com.my.ingest.domain.service.PollingClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 왜: 도메인 서비스와 포트 구현을 명시적으로 연결하여 헥사고날 구조를 보장하기 위함.
 */
@ApplicationScoped
public class DomainConfig {

    private static final Logger log = Logger.getLogger(DomainConfig.class);

    @Produces
    @ApplicationScoped
    public ClockPort clockPort() {
        return SystemClockAdapter.system();
    }

    @Produces
    @ApplicationScoped
    public BackoffPolicy backoffPolicy(AppConfig appConfig) {
        return new BackoffPolicy(retryPolicy(appConfig.retry()));
    }

    @Produces
    @ApplicationScoped
    public AccountPollingUseCase accountPollingUseCase(AppConfig appConfig,
                                                       OffsetStorePort offsetStore,
                                                       BackoffPolicy backoffPolicy,
                                                       EventProcessorPort eventProcessor,
                                                       PollingErrorListener errorListener,
                                                       ClockPort clockPort,
                                                       ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        PollingOptions options = pollingOptions(appConfig);
        List<PollingClient> clients = new ArrayList<>();
        for (Map.Entry<String, AppConfig.AccountConfig> entry : appConfig.accounts().entrySet()) {
            AppConfig.AccountConfig account = entry.getValue();
            if (!account.enabled()) {
                continue;
            }
            List<String> problems = ConfigValidator.accountProblems(entry.getKey(), account);
            if (!problems.isEmpty()) {
                log.warnf("설정이 완전하지 않아 계정을 건너뜁니다: account=%s problems=%s", entry.getKey(), problems);
                continue;
            }
            CredentialPort credentials = credentials(entry.getKey(), account, httpClient, objectMapper, clockPort);
            HttpFetchTransport transport = new HttpFetchTransport(URI.create(account.baseUrl().orElseThrow()), credentials, httpClient, objectMapper);
            clients.add(new PollingClient(entry.getKey(), transport, offsetStore, backoffPolicy, clockPort, options));
        }
        AccountSupervisor supervisor = new AccountSupervisor(clients);
        supervisor.onEvent(eventProcessor);
        supervisor.onError(errorListener);
        return supervisor;
    }

    static PollingOptions pollingOptions(AppConfig appConfig) {
        AppConfig.PollingConfig polling = appConfig.polling();
        return new PollingOptions(polling.timeoutSeconds(),
                polling.batchSize(),
                retryPolicy(appConfig.retry()),
                polling.autoResume(),
                Duration.ofSeconds(polling.shutdownTimeoutSeconds()));
    }

    static RetryPolicy retryPolicy(AppConfig.RetryConfig retry) {
        return new RetryPolicy(Duration.ofMillis(retry.initialDelayMs()),
                Duration.ofMillis(retry.maxDelayMs()),
                retry.factor(),
                retry.jitter(),
                retry.maxRetries(),
                Duration.ofMillis(retry.rateLimitFloorMs()));
    }

    static CredentialPort credentials(String accountId,
                                      AppConfig.AccountConfig account,
                                      HttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      ClockPort clockPort) {
        if (account.tokenUrl().isPresent()) {
            String clientId = account.clientId()
                    .orElseThrow(() -> new IllegalStateException("client-id가 없습니다: account=" + accountId));
            String clientSecret = account.clientSecret()
                    .orElseThrow(() -> new IllegalStateException("client-secret이 없습니다: account=" + accountId));
            return new TokenExchangeCredentialProvider(URI.create(account.tokenUrl().get()), clientId, clientSecret,
                    httpClient, objectMapper, clockPort);
        }
        String token = account.token()
                .orElseThrow(() -> new IllegalStateException("token이 없습니다: account=" + accountId));
        return new StaticCredentialProvider(token);
    }
}
