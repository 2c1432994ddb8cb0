package com.my.ingest.domain.service;

import com.my.ingest.domain.exception.InvalidStateException;
import com.my.ingest.domain.exception.PollingFailedException;
import com.my.ingest.domain.model.CancellationToken;
import com.my.ingest.domain.model.Cursor;
import com.my.ingest.domain.model.ErrorKind;
import com.my.ingest.domain.model.EventBatch;
import com.my.ingest.domain.model.OffsetRecord;
import com.my.ingest.domain.model.PollingError;
import com.my.ingest.domain.model.PollingOptions;
import com.my.ingest.domain.model.RawEvent;
import com.my.ingest.domain.model.SessionState;
import com.my.ingest.domain.model.SessionStatus;
import com.my.ingest.domain.port.out.ClockPort;
import com.my.ingest.domain.port.out.EventProcessorPort;
import com.my.ingest.domain.port.out.FetchTransportPort;
import com.my.ingest.domain.port.out.OffsetStorePort;
import com.my.ingest.domain.port.out.PollingErrorListener;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 계정 하나의 롱폴링 세션을 상태 머신으로 관리해 조회-전달-커서 저장 순서와 재시도 정책을 보장하기 위함.
 *
 * <p>상태 전이:
 * <pre>
 * IDLE --start()--> CONNECTING --첫 조회 성공--> POLLING &lt;--pause()/resume()--&gt; PAUSED
 * CONNECTING|POLLING --재시도 불가 또는 한도 초과--> ERROR --resume() 또는 자동 재개--> CONNECTING
 * 모든 상태 --stop()--> STOPPED
 * </pre>
 *
 * <p>루프는 전용 스레드 하나에서만 돌기 때문에 같은 계정에 대해 동시에 두 개의 조회가 나가지 않는다.
 * 커서는 배치의 모든 이벤트를 처리기에 넘긴 뒤에만 저장되므로 최소 한 번 전달이 보장된다.
 *
 * <p>pause()는 POLLING 에서만, resume()은 PAUSED/ERROR 에서만 전이하며 그 외 상태에서는 false 를 반환하는 no-op 이다.
 * 진행 중인 조회는 pause() 이후에도 끝까지 수행되고 그 배치는 정상적으로 전달/커밋된다.
 */
public class PollingClient {

    private static final Logger log = Logger.getLogger(PollingClient.class);

    private final String accountId;
    private final FetchTransportPort transport;
    private final OffsetStorePort offsetStore;
    private final BackoffPolicy backoffPolicy;
    private final ClockPort clockPort;
    private final PollingOptions options;
    private final ErrorClassifier errorClassifier = new ErrorClassifier();
    private final ExecutorService executor;
    private final CancellationToken cancellation = new CancellationToken();
    private final CompletableFuture<Void> started = new CompletableFuture<>();
    private final AtomicReference<EventProcessorPort> eventProcessor = new AtomicReference<>();
    private final AtomicReference<PollingErrorListener> errorListener = new AtomicReference<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition stateChanged = lock.newCondition();
    private SessionState state = SessionState.IDLE;
    private boolean loopActive;
    private long resumeAtNanos;

    private volatile Cursor cursor;
    private volatile Instant lastEventTime;
    private volatile boolean cursorLoaded;
    private volatile int attempts;
    private volatile PollingError lastError;
    private volatile Thread loopThread;

    public PollingClient(String accountId,
                         FetchTransportPort transport,
                         OffsetStorePort offsetStore,
                         BackoffPolicy backoffPolicy,
                         ClockPort clockPort,
                         PollingOptions options) {
        this.accountId = Objects.requireNonNull(accountId, "accountId");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.offsetStore = Objects.requireNonNull(offsetStore, "offsetStore");
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.clockPort = Objects.requireNonNull(clockPort, "clockPort");
        this.options = Objects.requireNonNull(options, "options");
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "polling-" + accountId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public String accountId() {
        return accountId;
    }

    /**
     * 이벤트 처리기를 등록한다. 이미 등록된 처리기는 교체된다.
     */
    public void onEvent(EventProcessorPort processor) {
        if (eventProcessor.getAndSet(Objects.requireNonNull(processor, "processor")) != null) {
            log.debugf("이벤트 처리기를 교체합니다: account=%s", accountId);
        }
    }

    /**
     * 오류 리스너를 등록한다. 이미 등록된 리스너는 교체된다.
     */
    public void onError(PollingErrorListener listener) {
        if (errorListener.getAndSet(Objects.requireNonNull(listener, "listener")) != null) {
            log.debugf("오류 리스너를 교체합니다: account=%s", accountId);
        }
    }

    /**
     * 폴링 루프를 시작한다.
     *
     * @return 처음 POLLING 에 도달하면 완료되고, 그 전에 ERROR 가 되면 {@link PollingFailedException}으로,
     * 그 전에 stop()되면 취소로 완료되는 Future
     * @throws InvalidStateException IDLE 이 아닌 상태에서 호출한 경우
     * @throws IllegalStateException   IDLE 이지만 이벤트 처리기가 등록되지 않은 경우
     */
    public CompletableFuture<Void> start() {
        lock.lock();
        try {
            if (state != SessionState.IDLE) {
                throw new InvalidStateException("start", state);
            }
            if (eventProcessor.get() == null) {
                throw new IllegalStateException("이벤트 처리기가 등록되지 않았습니다: account=" + accountId);
            }
            transitionTo(SessionState.CONNECTING);
            launchLoop();
        } finally {
            lock.unlock();
        }
        return started.copy();
    }

    public boolean pause() {
        lock.lock();
        try {
            if (state != SessionState.POLLING) {
                log.debugf("POLLING 상태가 아니므로 pause()를 무시합니다: account=%s state=%s", accountId, state);
                return false;
            }
            transitionTo(SessionState.PAUSED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean resume() {
        lock.lock();
        try {
            if (state == SessionState.PAUSED) {
                transitionTo(SessionState.POLLING);
                stateChanged.signalAll();
                return true;
            }
            if (state == SessionState.ERROR) {
                attempts = 0;
                transitionTo(SessionState.CONNECTING);
                stateChanged.signalAll();
                if (!loopActive) {
                    launchLoop();
                }
                log.infof("오류 상태에서 재개합니다: account=%s", accountId);
                return true;
            }
            log.debugf("재개할 수 없는 상태이므로 resume()을 무시합니다: account=%s state=%s", accountId, state);
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 정지를 요청하고 루프 스레드가 끝날 때까지 기다린다. 어떤 상태에서든 호출할 수 있으며 여러 번 호출해도 안전하다.
     */
    public void stop() {
        requestStop();
        awaitStopped();
    }

    /**
     * 정지 신호만 보낸다. 진행 중인 조회는 중단되고 백오프 대기는 즉시 깨어난다.
     */
    public void requestStop() {
        lock.lock();
        try {
            if (state == SessionState.STOPPED) {
                return;
            }
            transitionTo(SessionState.STOPPED);
            stateChanged.signalAll();
        } finally {
            lock.unlock();
        }
        cancellation.cancel();
        started.cancel(false);
        log.infof("폴링 정지 요청: account=%s", accountId);
    }

    /**
     * {@link #requestStop()} 이후 루프 스레드 종료를 기다린다. 루프 스레드 안에서 호출되면 기다리지 않는다.
     */
    public void awaitStopped() {
        executor.shutdown();
        if (Thread.currentThread() == loopThread) {
            return;
        }
        try {
            if (!executor.awaitTermination(options.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warnf("제한 시간 안에 폴링 루프가 끝나지 않아 강제 중단합니다: account=%s timeout=%s",
                        accountId, options.shutdownTimeout());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 저장된 커서를 지우고 다음 시작 시 보존 구간의 처음부터 다시 받도록 한다.
     *
     * @throws InvalidStateException 루프가 조회 중일 수 있는 상태(CONNECTING, POLLING, PAUSED)에서 호출한 경우
     */
    public void resetCursor() {
        lock.lock();
        try {
            if (state != SessionState.IDLE && state != SessionState.ERROR && state != SessionState.STOPPED) {
                throw new InvalidStateException("resetCursor", state);
            }
            offsetStore.deleteCursor(accountId);
            cursor = null;
            lastEventTime = null;
            cursorLoaded = true;
            log.infof("커서를 초기화했습니다: account=%s", accountId);
        } finally {
            lock.unlock();
        }
    }

    public SessionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public SessionStatus status() {
        return new SessionStatus(accountId, state(), cursor, attempts, lastError);
    }

    private void launchLoop() {
        loopActive = true;
        executor.execute(this::runLoop);
    }

    private void runLoop() {
        loopThread = Thread.currentThread();
        try {
            while (awaitRunnable()) {
                try {
                    pollOnce();
                } catch (RuntimeException e) {
                    if (!cancellation.isCancelled()) {
                        handleFailureSafely(e);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lock.lock();
            try {
                loopActive = false;
            } finally {
                lock.unlock();
            }
        } finally {
            loopThread = null;
        }
    }

    /**
     * 다음 조회를 해도 되는 상태가 될 때까지 기다린다. PAUSED 동안은 대기하고, 자동 재개가 켜진 ERROR 에서는
     * 재개 시각까지 기다린 뒤 CONNECTING 으로 돌아간다.
     *
     * @return 루프를 계속해야 하면 true
     */
    private boolean awaitRunnable() throws InterruptedException {
        lock.lock();
        try {
            while (!cancellation.isCancelled()) {
                if (state == SessionState.CONNECTING || state == SessionState.POLLING) {
                    return true;
                }
                if (state == SessionState.PAUSED) {
                    stateChanged.await();
                } else if (state == SessionState.ERROR && options.autoResume()) {
                    long remaining = resumeAtNanos - System.nanoTime();
                    if (remaining <= 0) {
                        attempts = 0;
                        transitionTo(SessionState.CONNECTING);
                        log.infof("오류 상태에서 자동 재개합니다: account=%s", accountId);
                        return true;
                    }
                    stateChanged.awaitNanos(remaining);
                } else {
                    break;
                }
            }
            loopActive = false;
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void pollOnce() {
        loadCursorIfNeeded();
        EventBatch batch = transport.fetch(Optional.ofNullable(cursor), options.timeoutSeconds(), options.batchSize(), cancellation);
        if (cancellation.isCancelled()) {
            log.debugf("정지 요청 이후 도착한 응답을 버립니다: account=%s", accountId);
            return;
        }
        markFetchSucceeded();
        if (!deliver(batch)) {
            return;
        }
        commit(batch);
        attempts = 0;
    }

    private void loadCursorIfNeeded() {
        if (cursorLoaded) {
            return;
        }
        Optional<OffsetRecord> stored = offsetStore.readCursor(accountId);
        cursor = stored.map(OffsetRecord::cursor).orElse(null);
        lastEventTime = stored.map(OffsetRecord::lastEventTime).orElse(null);
        cursorLoaded = true;
        log.infof("저장된 커서로 시작합니다: account=%s cursor=%s",
                accountId, cursor == null ? "(처음부터)" : cursor.value());
    }

    private void markFetchSucceeded() {
        lock.lock();
        try {
            if (state == SessionState.CONNECTING) {
                transitionTo(SessionState.POLLING);
                log.infof("폴링 중: account=%s", accountId);
            }
        } finally {
            lock.unlock();
        }
        started.complete(null);
    }

    /**
     * 배치의 이벤트를 받은 순서대로 하나씩 처리기에 넘긴다.
     *
     * @return 배치 전체를 넘겼으면 true, 정지 요청으로 중간에 멈췄으면 false
     */
    private boolean deliver(EventBatch batch) {
        for (RawEvent event : batch.events()) {
            if (cancellation.isCancelled()) {
                log.infof("정지 요청으로 배치 전달을 중단합니다. 커서는 전진하지 않습니다: account=%s", accountId);
                return false;
            }
            dispatch(event);
        }
        return true;
    }

    private void dispatch(RawEvent event) {
        MDC.put("accountId", accountId);
        MDC.put("eventId", event.eventId());
        try {
            eventProcessor.get().process(accountId, event);
        } catch (RuntimeException e) {
            log.warnf("이벤트 처리 실패, 나머지 이벤트는 계속 전달합니다: type=%s cause=%s", event.type(), e.getMessage());
            report(PollingError.processing(accountId, event.eventId(), e, clockPort.now()));
        } finally {
            MDC.remove("accountId");
            MDC.remove("eventId");
        }
    }

    private void commit(EventBatch batch) {
        Cursor next = batch.nextCursor();
        if (batch.isEmpty() && next.equals(cursor)) {
            return;
        }
        Instant eventTime = latestEventTime(batch);
        offsetStore.writeCursor(OffsetRecord.of(accountId, next, eventTime));
        cursor = next;
        lastEventTime = eventTime;
        log.debugf("커서 저장: account=%s events=%d cursor=%s", accountId, batch.events().size(), next.value());
    }

    private Instant latestEventTime(EventBatch batch) {
        Instant latest = lastEventTime;
        for (RawEvent event : batch.events()) {
            Instant candidate = event.occurredAt() != null ? event.occurredAt() : clockPort.now();
            if (latest == null || candidate.isAfter(latest)) {
                latest = candidate;
            }
        }
        return latest;
    }

    /**
     * 실패 처리 자체가 예외를 던져도 루프 스레드가 조용히 죽지 않고 ERROR 로 전환되게 한다.
     */
    private void handleFailureSafely(RuntimeException error) throws InterruptedException {
        try {
            handleFailure(error);
        } catch (RuntimeException e) {
            e.addSuppressed(error);
            log.errorf(e, "실패 처리 중 예외가 발생했습니다: account=%s", accountId);
            enterError(ErrorKind.UNEXPECTED, e, attempts);
        }
    }

    private void handleFailure(RuntimeException error) throws InterruptedException {
        ErrorKind kind = errorClassifier.classify(error);
        int attempt = attempts;
        if (backoffPolicy.shouldRetry(attempt, kind)) {
            Duration delay = backoffPolicy.delay(attempt, kind, errorClassifier.retryAfter(error).orElse(null));
            attempts = attempt + 1;
            log.warnf("폴링 실패, %dms 후 재시도합니다: account=%s kind=%s attempt=%d cause=%s",
                    delay.toMillis(), accountId, kind, attempt + 1, error.getMessage());
            cancellation.sleep(delay);
            return;
        }
        enterError(kind, error, attempt);
    }

    private void enterError(ErrorKind kind, RuntimeException error, int attempt) {
        PollingError failure = PollingError.terminal(accountId, kind, error, clockPort.now());
        lock.lock();
        try {
            if (state == SessionState.STOPPED) {
                return;
            }
            transitionTo(SessionState.ERROR);
            if (options.autoResume()) {
                resumeAtNanos = System.nanoTime() + backoffPolicy.autoResumeDelay().toNanos();
            }
        } finally {
            lock.unlock();
        }
        if (kind.retryable()) {
            log.errorf("재시도 한도를 초과해 오류 상태로 전환합니다: account=%s kind=%s attempts=%d cause=%s",
                    accountId, kind, attempt, error.getMessage());
        } else {
            log.errorf("재시도할 수 없는 오류로 오류 상태로 전환합니다: account=%s kind=%s cause=%s",
                    accountId, kind, error.getMessage());
        }
        if (options.autoResume()) {
            log.infof("%s 후 자동 재개합니다: account=%s", backoffPolicy.autoResumeDelay(), accountId);
        }
        started.completeExceptionally(new PollingFailedException(accountId, kind, error));
        report(failure);
    }

    private void report(PollingError error) {
        lastError = error;
        PollingErrorListener listener = errorListener.get();
        if (listener == null) {
            return;
        }
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            log.warnf(e, "오류 리스너 실행 중 예외: account=%s", accountId);
        }
    }

    private void transitionTo(SessionState next) {
        SessionState previous = state;
        state = next;
        log.debugf("상태 전이: account=%s %s -> %s", accountId, previous, next);
    }
}
