package com.my.ingest.domain.model;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 왜: 롱폴링 요청과 백오프 대기처럼 블로킹되는 모든 지점이 세션 하나의 취소 신호를 공유하도록 하기 위함.
 *
 * <p>취소는 협조적이다. 호출자는 {@link #isCancelled()}를 확인하거나 {@link #onCancel(Runnable)}로
 * 진행 중인 작업을 중단할 콜백을 등록한다. 각 콜백은 정확히 한 번만 실행된다.
 */
public final class CancellationToken {

    private static final Logger log = Logger.getLogger(CancellationToken.class);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void cancel() {
        if (isCancelled()) {
            return;
        }
        cancelled.countDown();
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runCallback(callback);
            }
        }
    }

    /**
     * 취소 시 실행할 콜백을 등록한다. 이미 취소된 경우 즉시 실행된다.
     *
     * @return 작업이 끝났을 때 닫아서 콜백을 해제하는 핸들
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * 주어진 시간만큼 대기한다.
     *
     * @return 대기를 모두 마쳤으면 true, 도중에 취소되었으면 false
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return !isCancelled();
        }
        return !cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warnf(e, "취소 콜백 실행 중 예외: %s", e.getMessage());
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
