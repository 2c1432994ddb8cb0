package com.my.ingest.domain.model;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * 왜: 재시도 간격과 한도를 설정값 하나로 묶어 계정마다 같은 정책을 적용하기 위함.
 *
 * <p>{@code maxRetries}가 비어 있으면 재시도 가능한 오류는 무한히 재시도한다.
 */
public record RetryPolicy(Duration initialDelay,
                          Duration maxDelay,
                          double factor,
                          double jitter,
                          OptionalInt maxRetries,
                          Duration rateLimitFloor) {

    public RetryPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(maxRetries, "maxRetries");
        Objects.requireNonNull(rateLimitFloor, "rateLimitFloor");
        if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay는 initialDelay 이상이어야 합니다: initial=" + initialDelay + ", max=" + maxDelay);
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor는 1.0 이상이어야 합니다: " + factor);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter는 0.0 ~ 1.0 사이여야 합니다: " + jitter);
        }
        if (maxRetries.isPresent() && maxRetries.getAsInt() < 0) {
            throw new IllegalArgumentException("maxRetries는 음수일 수 없습니다: " + maxRetries.getAsInt());
        }
        if (rateLimitFloor.isNegative()) {
            throw new IllegalArgumentException("rateLimitFloor는 음수일 수 없습니다: " + rateLimitFloor);
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(1), Duration.ofMinutes(1), 2.0, 0.1, OptionalInt.empty(), Duration.ofSeconds(5));
    }
}
