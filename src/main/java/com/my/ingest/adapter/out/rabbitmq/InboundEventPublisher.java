package com.my.ingest.adapter.out.rabbitmq;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.ingest.domain.exception.EventProcessingException;
import com.my.ingest.domain.model.RawEvent;
import com.my.ingest.domain.port.out.EventProcessorPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.eclipse.microprofile.reactive.messaging.Channel;
import org.eclipse.microprofile.reactive.messaging.Emitter;

import java.util.concurrent.ExecutionException;

/**
 * 왜: 수신한 원시 이벤트를 RabbitMQ로 넘기는 드리븐 어댑터를 분리해 디스패처 전달 경로를 명확히 하기 위함.
 *
 * <p>브로커의 확인(ack)을 받은 뒤에 반환하므로, 커서는 브로커가 받은 이벤트까지만 전진한다.
 * 일시적인 nack 은 여기서 재시도하고, 그래도 실패하면 처리 실패로 보고된다.
 */
@ApplicationScoped
public class InboundEventPublisher implements EventProcessorPort {

    private final Emitter<String> emitter;
    private final ObjectMapper objectMapper;

    @Inject
    public InboundEventPublisher(@Channel("inbound-events") Emitter<String> emitter,
                                 ObjectMapper objectMapper) {
        this.emitter = emitter;
        this.objectMapper = objectMapper;
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000)
    public void process(String accountId, RawEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(new OutgoingPayload(accountId, event));
        } catch (JsonProcessingException e) {
            throw new EventProcessingException("이벤트 직렬화 실패: " + event.eventId(), e);
        }
        try {
            emitter.send(payload).toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventProcessingException("이벤트 전송 대기 중 중단되었습니다: " + event.eventId(), e);
        } catch (ExecutionException e) {
            throw new EventProcessingException("이벤트 전송 실패: " + event.eventId(), e.getCause());
        }
    }

    private record OutgoingPayload(String accountId,
                                   String eventId,
                                   String type,
                                   String occurredAt,
                                   @JsonRawValue String payload) {
        private OutgoingPayload(String accountId, RawEvent event) {
            this(accountId,
                    event.eventId(),
                    event.type(),
                    event.occurredAt() == null ? null : event.occurredAt().toString(),
                    event.payload());
        }
    }
}
