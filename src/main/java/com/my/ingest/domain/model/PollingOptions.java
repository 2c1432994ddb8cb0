package com.my.ingest.domain.model;

import java.time.Duration;
import java.util.Objects;

public record PollingOptions(int timeoutSeconds,
                             int batchSize,
                             RetryPolicy retryPolicy,
                             boolean autoResume,
                             Duration shutdownTimeout) {

    public PollingOptions {
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds는 양수여야 합니다: " + timeoutSeconds);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize는 양수여야 합니다: " + batchSize);
        }
    }

    public static PollingOptions defaults() {
        return new PollingOptions(30, 100, RetryPolicy.defaults(), false, Duration.ofSeconds(10));
    }
}
