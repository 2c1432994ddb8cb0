package com.my.ingest.domain.exception;

/**
 * 왜: 개별 이벤트 처리 실패를 폴링 실패와 구분해 배치 전달을 멈추지 않도록 하기 위함.
 */
public class EventProcessingException extends RuntimeException {
    public EventProcessingException(String message) {
        super(message);
    }

    public EventProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
