package com.my.ingest.domain.port.out;

import com.my.ingest.domain.model.CancellationToken;
import com.my.ingest.domain.model.Cursor;
import com.my.ingest.domain.model.EventBatch;

import java.util.Optional;

/**
 * 왜: 롱폴링 HTTP/토큰 교환 세부사항을 감춰 상태 머신을 전송 구현과 분리하기 위함.
 *
 * <p>구현은 최대 {@code timeoutSeconds} 동안 블로킹될 수 있으며, 취소 토큰이 취소되면 요청을 중단하고
 * {@link java.util.concurrent.CancellationException}을 던져야 한다. 실패는
 * {@link com.my.ingest.domain.exception.TransportException}으로 분류해 던진다.
 */
public interface FetchTransportPort {
    EventBatch fetch(Optional<Cursor> cursor, int timeoutSeconds, int batchSize, CancellationToken cancellation);
}
