package com.my.ingest.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    PollingConfig polling();

    RetryConfig retry();

    @WithName("offset-store")
    OffsetStoreConfig offsetStore();

    Map<String, AccountConfig> accounts();

    interface PollingConfig {
        @WithName("timeout-seconds")
        @WithDefault("30")
        int timeoutSeconds();

        @WithName("batch-size")
        @WithDefault("100")
        int batchSize();

        @WithName("auto-resume")
        @WithDefault("false")
        boolean autoResume();

        @WithName("shutdown-timeout-seconds")
        @WithDefault("10")
        int shutdownTimeoutSeconds();
    }

    interface RetryConfig {
        @WithName("initial-delay-ms")
        @WithDefault("1000")
        long initialDelayMs();

        @WithName("max-delay-ms")
        @WithDefault("60000")
        long maxDelayMs();

        @WithDefault("2.0")
        double factor();

        @WithDefault("0.1")
        double jitter();

        @WithName("max-retries")
        OptionalInt maxRetries();

        @WithName("rate-limit-floor-ms")
        @WithDefault("5000")
        long rateLimitFloorMs();
    }

    interface OffsetStoreConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("path")
        @WithDefault("./data/offsets")
        String path();

        @WithName("sqlite-path")
        @WithDefault("./data/offsets.db")
        String sqlitePath();
    }

    interface AccountConfig {
        @WithName("base-url")
        Optional<String> baseUrl();

        @WithName("token")
        Optional<String> token();

        @WithName("token-url")
        Optional<String> tokenUrl();

        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithDefault("true")
        boolean enabled();
    }
}
