package com.my.ingest.domain.service;

import com.my.ingest.domain.exception.OffsetStoreException;
import com.my.ingest.domain.exception.TransportException;
import com.my.ingest.domain.model.ErrorKind;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 왜: 폴링 중 발생한 예외를 재시도 정책이 이해하는 분류로 변환하는 규칙을 한 곳에 모으기 위함.
 */
public class ErrorClassifier {

    public ErrorKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TransportException transportException) {
            return transportException.kind();
        }
        if (cause instanceof OffsetStoreException) {
            return ErrorKind.OFFSET_STORE;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return ErrorKind.NETWORK;
        }
        return ErrorKind.UNEXPECTED;
    }

    public Optional<Duration> retryAfter(Throwable error) {
        if (unwrap(error) instanceof TransportException transportException) {
            return transportException.retryAfter();
        }
        return Optional.empty();
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
