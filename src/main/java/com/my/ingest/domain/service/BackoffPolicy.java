package com.my.ingest.domain.service;

import com.my.ingest.domain.model.ErrorKind;
import com.my.ingest.domain.model.RetryPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>여러 계정이 동시에 재시도하며 몰리지 않도록 대칭 jitter를 더한다.</p>
 *
 * <pre>
 * delay = min(maxDelay, initialDelay * factor^attempt) * (1 + u),  u ∈ [-jitter, +jitter]
 * </pre>
 *
 * <p>RATE_LIMITED 는 rateLimitFloor 와 서버가 알려준 Retry-After 중 큰 값을 하한으로 사용한다.
 * 결과는 항상 [0, maxDelay] 범위로 제한된다.</p>
 */
public class BackoffPolicy {

    private final RetryPolicy retryPolicy;
    private final DoubleSupplier random;

    public BackoffPolicy(RetryPolicy retryPolicy) {
        this(retryPolicy, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random [0, 1) 범위의 난수 공급자
     */
    public BackoffPolicy(RetryPolicy retryPolicy, DoubleSupplier random) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * 연속 실패 횟수가 {@code attempt}일 때 한 번 더 재시도할지 판단한다.
     */
    public boolean shouldRetry(int attempt, ErrorKind kind) {
        if (!kind.retryable()) {
            return false;
        }
        return retryPolicy.maxRetries().isEmpty() || attempt < retryPolicy.maxRetries().getAsInt();
    }

    public Duration delay(int attempt, ErrorKind kind) {
        return delay(attempt, kind, null);
    }

    /**
     * @param attempt        직전 성공 이후 누적된 실패 횟수 (0부터 시작)
     * @param retryAfterHint 서버가 알려준 대기 시간, 없으면 null
     */
    public Duration delay(int attempt, ErrorKind kind, Duration retryAfterHint) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt는 음수일 수 없습니다: " + attempt);
        }
        long maxMs = retryPolicy.maxDelay().toMillis();
        double exponential = retryPolicy.initialDelay().toMillis() * Math.pow(retryPolicy.factor(), attempt);
        long base = (long) Math.min(maxMs, exponential);
        if (kind == ErrorKind.RATE_LIMITED) {
            Duration floor = retryPolicy.rateLimitFloor();
            if (retryAfterHint != null && retryAfterHint.compareTo(floor) > 0) {
                floor = retryAfterHint;
            }
            // 서버 힌트는 밀리초로 표현할 수 없을 만큼 클 수 있으므로 Duration 상태에서 먼저 상한을 적용한다.
            long floorMs = floor.compareTo(retryPolicy.maxDelay()) >= 0 ? maxMs : floor.toMillis();
            base = Math.min(maxMs, Math.max(base, floorMs));
        }
        long jittered = applyJitter(base);
        return Duration.ofMillis(Math.max(0, Math.min(maxMs, jittered)));
    }

    /**
     * 자동 재개 전 대기 시간. 오류 상태에서는 가장 긴 백오프만큼 쉰다.
     */
    public Duration autoResumeDelay() {
        return retryPolicy.maxDelay();
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    private long applyJitter(long base) {
        if (retryPolicy.jitter() == 0.0) {
            return base;
        }
        double perturbation = (random.getAsDouble() * 2 - 1) * retryPolicy.jitter();
        return Math.round(base * (1 + perturbation));
    }
}
