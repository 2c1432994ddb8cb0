package com.my.ingest.adapter.out.health;

import com.my.ingest.domain.model.SessionStatus;
import com.my.ingest.domain.port.in.AccountPollingUseCase;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class PollingReadinessCheck implements HealthCheck {

    private final AccountPollingUseCase accountPollingUseCase;

    public PollingReadinessCheck(AccountPollingUseCase accountPollingUseCase) {
        this.accountPollingUseCase = accountPollingUseCase;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.named("polling-readiness");
        for (SessionStatus status : accountPollingUseCase.snapshots()) {
            builder.withData(status.accountId(), status.state().name());
            status.lastReportedError()
                    .ifPresent(error -> builder.withData(status.accountId() + ".lastError", error.kind() + ": " + error.message()));
        }
        return builder.status(accountPollingUseCase.isHealthy()).build();
    }
}
