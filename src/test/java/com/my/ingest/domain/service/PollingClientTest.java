package com.my.ingest.domain.service;

import com.my.ingest.adapter.out.offset.InMemoryOffsetStore;
import com.my.ingest.domain.exception.InvalidStateException;
import com.my.ingest.domain.exception.OffsetStoreException;
import com.my.ingest.domain.exception.PollingFailedException;
import com.my.ingest.domain.exception.TransportException;
import com.my.ingest.domain.model.Cursor;
import com.my.ingest.domain.model.ErrorKind;
import com.my.ingest.domain.model.OffsetRecord;
import com.my.ingest.domain.model.PollingError;
import com.my.ingest.domain.model.PollingOptions;
import com.my.ingest.domain.model.RawEvent;
import com.my.ingest.domain.model.RetryPolicy;
import com.my.ingest.domain.model.SessionState;
import com.my.ingest.domain.port.out.EventProcessorPort;
import com.my.ingest.domain.port.out.OffsetStorePort;
import com.my.ingest.domain.port.out.PollingErrorListener;
import com.my.ingest.support.Await;
import com.my.ingest.support.ScriptedTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PollingClientTest {

    private static final String ACCOUNT = "acc-1";
    private static final Instant NOW = Instant.parse("2026-01-13T00:00:00Z");

    private ScriptedTransport transport;
    private InMemoryOffsetStore store;
    private EventProcessorPort processor;
    private PollingErrorListener errorListener;
    private final List<PollingClient> clients = new ArrayList<>();

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        store = new InMemoryOffsetStore();
        processor = mock(EventProcessorPort.class);
        errorListener = mock(PollingErrorListener.class);
    }

    @AfterEach
    void tearDown() {
        clients.forEach(PollingClient::stop);
    }

    @Test
    void fresh_store_delivers_batch_in_order_and_persists_cursor() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        RawEvent first = event("e1", "2026-01-12T10:00:00Z");
        RawEvent second = event("e2", "2026-01-12T10:00:05Z");
        transport.thenReturn("c1", first, second);

        client.start().join();
        transport.awaitFetches(2);

        InOrder order = inOrder(processor);
        order.verify(processor).process(ACCOUNT, first);
        order.verify(processor).process(ACCOUNT, second);
        assertThat(transport.requestedCursors().get(0)).isEmpty();
        assertThat(transport.requestedCursors().get(1)).contains(new Cursor("c1"));
        OffsetRecord stored = store.readCursor(ACCOUNT).orElseThrow();
        assertThat(stored.cursor()).isEqualTo(new Cursor("c1"));
        assertThat(stored.lastEventTime()).isEqualTo(Instant.parse("2026-01-12T10:00:05Z"));
        assertThat(stored.schemaVersion()).isEqualTo(OffsetRecord.SCHEMA_VERSION);
        assertThat(client.state()).isEqualTo(SessionState.POLLING);
        assertThat(transport.maxConcurrentFetches()).isEqualTo(1);
    }

    @Test
    void restart_issues_first_fetch_with_stored_cursor() {
        store.writeCursor(OffsetRecord.of(ACCOUNT, new Cursor("c1"), null));
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));

        client.start();
        transport.awaitFetches(1);

        assertThat(transport.requestedCursors().get(0)).contains(new Cursor("c1"));
    }

    @Test
    void retryable_failures_then_success_reset_attempts_without_reporting() {
        PollingClient client = newClient(store, options(OptionalInt.of(5), false));
        transport.thenFail(new TransportException(ErrorKind.NETWORK, "reset"))
                .thenFail(new TransportException(ErrorKind.SERVER, "503"))
                .thenFail(new TransportException(ErrorKind.RATE_LIMITED, "429"))
                .thenReturn("c1", event("e1", null));

        client.start().join();
        transport.awaitFetches(5);

        assertThat(client.status().attempts()).isZero();
        assertThat(client.state()).isEqualTo(SessionState.POLLING);
        assertThat(store.readCursor(ACCOUNT)).map(OffsetRecord::cursor).contains(new Cursor("c1"));
        verify(errorListener, never()).onError(any());
    }

    @Test
    void auth_error_enters_error_on_first_failure_without_retry() {
        PollingClient client = newClient(store, options(OptionalInt.of(5), false));
        transport.thenFail(new TransportException(ErrorKind.AUTH, "401"))
                .thenReturn("c1");

        CompletableFuture<Void> started = client.start();

        assertThatThrownBy(started::join)
                .hasCauseInstanceOf(PollingFailedException.class)
                .satisfies(error -> assertThat(((PollingFailedException) error.getCause()).kind()).isEqualTo(ErrorKind.AUTH));
        assertThat(client.state()).isEqualTo(SessionState.ERROR);
        ArgumentCaptor<PollingError> captor = ArgumentCaptor.forClass(PollingError.class);
        verify(errorListener, timeout(2000)).onError(captor.capture());
        assertThat(transport.fetchCount()).isEqualTo(1);
        assertThat(client.status().lastError()).isNotNull();
        assertThat(captor.getValue().terminal()).isTrue();
        assertThat(captor.getValue().kind()).isEqualTo(ErrorKind.AUTH);
    }

    @Test
    void exhausted_retries_enter_error() {
        PollingClient client = newClient(store, options(OptionalInt.of(2), false));
        transport.thenFail(new TransportException(ErrorKind.SERVER, "500"))
                .thenFail(new TransportException(ErrorKind.SERVER, "502"))
                .thenFail(new TransportException(ErrorKind.SERVER, "503"));

        assertThatThrownBy(() -> client.start().join()).hasCauseInstanceOf(PollingFailedException.class);

        assertThat(client.state()).isEqualTo(SessionState.ERROR);
        assertThat(transport.fetchCount()).isEqualTo(3);
        assertThat(store.readCursor(ACCOUNT)).isEmpty();
    }

    @Test
    void processing_failure_does_not_stop_batch_or_cursor_advance() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        RawEvent first = event("e1", null);
        RawEvent broken = event("e2", null);
        RawEvent third = event("e3", null);
        doThrow(new IllegalArgumentException("bad payload")).when(processor).process(ACCOUNT, broken);
        transport.thenReturn("c1", first, broken, third);

        client.start().join();
        transport.awaitFetches(2);

        InOrder order = inOrder(processor);
        order.verify(processor).process(ACCOUNT, first);
        order.verify(processor).process(ACCOUNT, broken);
        order.verify(processor).process(ACCOUNT, third);
        assertThat(store.readCursor(ACCOUNT)).map(OffsetRecord::cursor).contains(new Cursor("c1"));
        ArgumentCaptor<PollingError> captor = ArgumentCaptor.forClass(PollingError.class);
        verify(errorListener).onError(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(ErrorKind.PROCESSING);
        assertThat(captor.getValue().eventId()).isEqualTo("e2");
        assertThat(captor.getValue().terminal()).isFalse();
        assertThat(client.state()).isEqualTo(SessionState.POLLING);
    }

    @Test
    void empty_response_with_unchanged_cursor_skips_store_write() {
        OffsetStorePort spyStore = spy(new InMemoryOffsetStore());
        PollingClient client = newClient(spyStore, options(OptionalInt.of(3), false));
        transport.thenReturn("c1", event("e1", null))
                .thenReturn("c1")
                .thenReturn("c2");

        client.start().join();
        transport.awaitFetches(4);

        verify(spyStore, times(2)).writeCursor(any());
        assertThat(spyStore.readCursor(ACCOUNT)).map(OffsetRecord::cursor).contains(new Cursor("c2"));
        assertThat(transport.requestedCursors().get(3)).contains(new Cursor("c2"));
    }

    @Test
    void events_without_timestamp_use_clock_for_last_event_time() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        transport.thenReturn("c1", event("e1", null));

        client.start().join();
        transport.awaitFetches(2);

        assertThat(store.readCursor(ACCOUNT)).map(OffsetRecord::lastEventTime).contains(NOW);
    }

    @Test
    void start_is_only_allowed_from_idle() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        client.start();

        assertThatThrownBy(client::start)
                .isInstanceOf(InvalidStateException.class)
                .satisfies(error -> assertThat(((InvalidStateException) error).currentState())
                        .isIn(SessionState.CONNECTING, SessionState.POLLING));

        client.stop();
        assertThatThrownBy(client::start).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void start_from_paused_or_error_is_rejected_with_current_state() {
        PollingClient paused = newClient(store, options(OptionalInt.of(3), false));
        transport.thenReturn("c1");
        paused.start().join();
        assertThat(paused.pause()).isTrue();

        assertThatThrownBy(paused::start)
                .isInstanceOfSatisfying(InvalidStateException.class,
                        error -> assertThat(error.currentState()).isEqualTo(SessionState.PAUSED));

        ScriptedTransport failing = new ScriptedTransport().thenFail(new TransportException(ErrorKind.AUTH, "401"));
        PollingClient failed = new PollingClient("acc-2", failing, store, new BackoffPolicy(fastRetry(OptionalInt.of(3))),
                () -> NOW, options(OptionalInt.of(3), false));
        failed.onEvent(processor);
        clients.add(failed);
        assertThatThrownBy(() -> failed.start().join()).hasCauseInstanceOf(PollingFailedException.class);

        assertThatThrownBy(failed::start)
                .isInstanceOfSatisfying(InvalidStateException.class,
                        error -> assertThat(error.currentState()).isEqualTo(SessionState.ERROR));
    }

    @Test
    void start_after_stop_reports_invalid_state_even_without_processor() {
        PollingClient client = new PollingClient(ACCOUNT, transport, store, new BackoffPolicy(fastRetry(OptionalInt.empty())),
                () -> NOW, options(OptionalInt.empty(), false));
        clients.add(client);
        client.stop();

        assertThatThrownBy(client::start)
                .isInstanceOfSatisfying(InvalidStateException.class,
                        error -> assertThat(error.currentState()).isEqualTo(SessionState.STOPPED));
    }

    @Test
    void oversized_retry_after_hint_is_capped_and_polling_continues() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        transport.thenFail(new TransportException(ErrorKind.RATE_LIMITED, "429", Duration.ofSeconds(99_999_999_999_999_999L)))
                .thenReturn("c1", event("e1", null));

        client.start().join();
        transport.awaitFetches(3);

        assertThat(client.state()).isEqualTo(SessionState.POLLING);
        assertThat(store.readCursor(ACCOUNT)).map(OffsetRecord::cursor).contains(new Cursor("c1"));
        verify(errorListener, never()).onError(any());
    }

    @Test
    void failure_while_scheduling_retry_enters_error_instead_of_killing_loop() {
        BackoffPolicy brokenBackoff = mock(BackoffPolicy.class);
        when(brokenBackoff.shouldRetry(anyInt(), any())).thenReturn(true);
        when(brokenBackoff.delay(anyInt(), any(), any())).thenThrow(new ArithmeticException("long overflow"));
        PollingOptions options = options(OptionalInt.of(3), false);
        PollingClient client = new PollingClient(ACCOUNT, transport, store, brokenBackoff, () -> NOW, options);
        client.onEvent(processor);
        client.onError(errorListener);
        clients.add(client);
        transport.thenFail(new TransportException(ErrorKind.NETWORK, "reset"))
                .thenReturn("c1");

        CompletableFuture<Void> started = client.start();

        assertThatThrownBy(started::join)
                .hasCauseInstanceOf(PollingFailedException.class)
                .satisfies(error -> assertThat(((PollingFailedException) error.getCause()).kind()).isEqualTo(ErrorKind.UNEXPECTED));
        assertThat(client.state()).isEqualTo(SessionState.ERROR);
        ArgumentCaptor<PollingError> captor = ArgumentCaptor.forClass(PollingError.class);
        verify(errorListener, timeout(2000)).onError(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(ErrorKind.UNEXPECTED);

        assertThat(client.resume()).isTrue();
        Await.until(() -> client.state() == SessionState.POLLING);
    }

    @Test
    void start_without_event_processor_is_rejected() {
        PollingClient client = new PollingClient(ACCOUNT, transport, store, new BackoffPolicy(fastRetry(OptionalInt.empty())),
                () -> NOW, options(OptionalInt.empty(), false));
        clients.add(client);

        assertThatThrownBy(client::start).isInstanceOf(IllegalStateException.class);
        assertThat(client.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void stop_is_idempotent_from_any_state() {
        PollingClient idle = newClient(store, options(OptionalInt.of(3), false));
        idle.stop();
        idle.stop();
        assertThat(idle.state()).isEqualTo(SessionState.STOPPED);

        PollingClient polling = newClient(new InMemoryOffsetStore(), options(OptionalInt.of(3), false));
        transport.thenReturn("c1");
        polling.start().join();
        transport.awaitFetches(2);

        polling.stop();

        assertThat(polling.state()).isEqualTo(SessionState.STOPPED);
        assertThat(transport.cancelledFetches()).isEqualTo(1);
    }

    @Test
    void stop_before_polling_cancels_start_future() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));

        CompletableFuture<Void> started = client.start();
        transport.awaitFetches(1);
        client.stop();

        assertThat(started).isCompletedExceptionally();
        assertThat(client.state()).isEqualTo(SessionState.STOPPED);
        assertThat(store.readCursor(ACCOUNT)).isEmpty();
    }

    @Test
    void stop_interrupts_backoff_sleep() {
        RetryPolicy slow = new RetryPolicy(Duration.ofSeconds(30), Duration.ofSeconds(30), 2.0, 0.0,
                OptionalInt.empty(), Duration.ZERO);
        PollingClient client = newClient(store, new PollingOptions(1, 10, slow, false, Duration.ofSeconds(5)));
        transport.thenFail(new TransportException(ErrorKind.NETWORK, "reset"));

        client.start();
        Await.until(() -> client.status().attempts() == 1);
        long begin = System.nanoTime();
        client.stop();

        assertThat(Duration.ofNanos(System.nanoTime() - begin)).isLessThan(Duration.ofSeconds(3));
        assertThat(client.state()).isEqualTo(SessionState.STOPPED);
        assertThat(transport.fetchCount()).isEqualTo(1);
    }

    @Test
    void stop_during_batch_keeps_cursor_unadvanced() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        RawEvent first = event("e1", null);
        RawEvent second = event("e2", null);
        doAnswer(invocation -> {
            client.stop();
            return null;
        }).when(processor).process(ACCOUNT, first);
        transport.thenReturn("c1", first, second);

        client.start();
        Await.until(() -> client.state() == SessionState.STOPPED);
        client.stop();

        verify(processor).process(ACCOUNT, first);
        verify(processor, never()).process(ACCOUNT, second);
        assertThat(store.readCursor(ACCOUNT)).isEmpty();
    }

    @Test
    void pause_blocks_new_fetches_until_resume() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        CountDownLatch release = new CountDownLatch(1);
        transport.thenReturn("c1")
                .thenReturnAfter(release, "c2", event("e1", null));

        client.start().join();
        transport.awaitFetches(2);

        assertThat(client.pause()).isTrue();
        assertThat(client.state()).isEqualTo(SessionState.PAUSED);
        release.countDown();
        Await.until(() -> store.readCursor(ACCOUNT).map(OffsetRecord::cursor).filter(new Cursor("c2")::equals).isPresent());
        sleep(Duration.ofMillis(100));
        assertThat(transport.fetchCount()).isEqualTo(2);

        assertThat(client.resume()).isTrue();
        transport.awaitFetches(3);
        assertThat(client.state()).isEqualTo(SessionState.POLLING);
        assertThat(transport.requestedCursors().get(2)).contains(new Cursor("c2"));
    }

    @Test
    void pause_and_resume_outside_their_states_are_no_ops() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));

        assertThat(client.pause()).isFalse();
        assertThat(client.resume()).isFalse();
        assertThat(client.state()).isEqualTo(SessionState.IDLE);
    }

    @Test
    void resume_from_error_reenters_connecting() {
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        transport.thenFail(new TransportException(ErrorKind.AUTH, "401"))
                .thenReturn("c1", event("e1", null));
        assertThatThrownBy(() -> client.start().join()).hasCauseInstanceOf(PollingFailedException.class);

        assertThat(client.resume()).isTrue();

        Await.until(() -> client.state() == SessionState.POLLING);
        transport.awaitFetches(3);
        assertThat(store.readCursor(ACCOUNT)).map(OffsetRecord::cursor).contains(new Cursor("c1"));
    }

    @Test
    void auto_resume_schedules_another_cycle_after_error() {
        PollingClient client = newClient(store, options(OptionalInt.of(0), true));
        transport.thenFail(new TransportException(ErrorKind.MALFORMED_RESPONSE, "bad body"))
                .thenReturn("c1", event("e1", null));

        assertThatThrownBy(() -> client.start().join()).hasCauseInstanceOf(PollingFailedException.class);

        Await.until(() -> client.state() == SessionState.POLLING);
        transport.awaitFetches(3);
        assertThat(store.readCursor(ACCOUNT)).map(OffsetRecord::cursor).contains(new Cursor("c1"));
        verify(errorListener, times(1)).onError(any());
        assertThat(client.status().lastError().kind()).isEqualTo(ErrorKind.MALFORMED_RESPONSE);
    }

    @Test
    void registering_handler_replaces_previous_one() {
        EventProcessorPort replacement = mock(EventProcessorPort.class);
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));
        client.onEvent(replacement);
        RawEvent first = event("e1", null);
        transport.thenReturn("c1", first);

        client.start().join();
        transport.awaitFetches(2);

        verify(replacement).process(ACCOUNT, first);
        verify(processor, never()).process(any(), any());
    }

    @Test
    void reset_cursor_clears_stored_offset_outside_active_states() {
        store.writeCursor(OffsetRecord.of(ACCOUNT, new Cursor("c9"), null));
        PollingClient client = newClient(store, options(OptionalInt.of(3), false));

        client.resetCursor();
        client.start();
        transport.awaitFetches(1);

        assertThat(store.readCursor(ACCOUNT)).isEmpty();
        assertThat(transport.requestedCursors().get(0)).isEmpty();
        assertThatThrownBy(client::resetCursor).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void offset_store_failure_redelivers_batch_without_advancing_cursor() {
        OffsetStorePort failingStore = mock(OffsetStorePort.class);
        when(failingStore.readCursor(ACCOUNT)).thenReturn(Optional.empty());
        doThrow(new OffsetStoreException("disk full"))
                .doNothing()
                .when(failingStore).writeCursor(any());
        PollingClient client = newClient(failingStore, options(OptionalInt.of(3), false));
        RawEvent first = event("e1", null);
        transport.thenReturn("c1", first)
                .thenReturn("c1", first);

        client.start().join();
        transport.awaitFetches(3);

        verify(processor, times(2)).process(ACCOUNT, first);
        assertThat(transport.requestedCursors().get(1)).isEmpty();
        assertThat(transport.requestedCursors().get(2)).contains(new Cursor("c1"));
        verify(failingStore, times(2)).writeCursor(eq(OffsetRecord.of(ACCOUNT, new Cursor("c1"), NOW)));
        verify(errorListener, never()).onError(any());
        assertThat(client.status().attempts()).isZero();
    }

    private PollingClient newClient(OffsetStorePort offsetStore, PollingOptions options) {
        PollingClient client = new PollingClient(ACCOUNT, transport, offsetStore,
                new BackoffPolicy(options.retryPolicy()), () -> NOW, options);
        client.onEvent(processor);
        client.onError(errorListener);
        clients.add(client);
        return client;
    }

    private static PollingOptions options(OptionalInt maxRetries, boolean autoResume) {
        return new PollingOptions(1, 10, fastRetry(maxRetries), autoResume, Duration.ofSeconds(5));
    }

    private static RetryPolicy fastRetry(OptionalInt maxRetries) {
        return new RetryPolicy(Duration.ofMillis(1), Duration.ofMillis(20), 2.0, 0.0, maxRetries, Duration.ofMillis(1));
    }

    private static RawEvent event(String id, String occurredAt) {
        return new RawEvent(id, "message", occurredAt == null ? null : Instant.parse(occurredAt), "{\"text\":\"" + id + "\"}");
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
