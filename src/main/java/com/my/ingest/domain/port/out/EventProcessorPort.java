package com.my.ingest.domain.port.out;

import com.my.ingest.domain.model.RawEvent;

/**
 * 왜: 수신한 이벤트의 후속 처리(디스패처)를 추상화해 폴링 루프가 처리 방식에 의존하지 않게 하기 위함.
 *
 * <p>같은 이벤트가 재전달될 수 있으므로 구현은 멱등해야 한다.
 */
@FunctionalInterface
public interface EventProcessorPort {
    void process(String accountId, RawEvent event);
}
