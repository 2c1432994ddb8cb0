package com.my.ingest.adapter.out.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.ingest.domain.exception.TransportException;
import com.my.ingest.domain.model.CancellationToken;
import com.my.ingest.domain.model.Cursor;
import com.my.ingest.domain.model.ErrorKind;
import com.my.ingest.domain.model.EventBatch;
import com.my.ingest.domain.model.RawEvent;
import com.my.ingest.domain.port.out.CredentialPort;
import com.my.ingest.domain.port.out.FetchTransportPort;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 왜: 플랫폼의 롱폴링 HTTP API 호출과 응답/상태 코드 해석을 캡슐화해 도메인에는 분류된 결과만 넘기기 위함.
 */
public class HttpFetchTransport implements FetchTransportPort {

    private static final Logger log = Logger.getLogger(HttpFetchTransport.class);
    private static final int REQUEST_TIMEOUT_MARGIN_SECONDS = 5;

    private final URI baseUri;
    private final CredentialPort credentials;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpFetchTransport(URI baseUri, CredentialPort credentials, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUri = baseUri;
        this.credentials = credentials;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public EventBatch fetch(Optional<Cursor> cursor, int timeoutSeconds, int batchSize, CancellationToken cancellation) {
        if (cancellation.isCancelled()) {
            throw new CancellationException("폴링 세션이 이미 취소되었습니다.");
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(pollUri(cursor, timeoutSeconds, batchSize))
                .header("Authorization", "Bearer " + credentials.bearerToken())
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(timeoutSeconds + REQUEST_TIMEOUT_MARGIN_SECONDS))
                .GET()
                .build();
        CompletableFuture<HttpResponse<String>> pending = httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        try (CancellationToken.Registration ignored = cancellation.onCancel(() -> pending.cancel(true))) {
            return toBatch(pending.get());
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("롱폴링 요청이 중단되었습니다.");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            ErrorKind kind = cause instanceof IOException ? ErrorKind.NETWORK : ErrorKind.UNEXPECTED;
            throw new TransportException(kind, "롱폴링 요청 실패: " + cause, cause);
        }
    }

    URI pollUri(Optional<Cursor> cursor, int timeoutSeconds, int batchSize) {
        StringBuilder url = new StringBuilder(trimTrailingSlash(baseUri.toString()))
                .append("/events/poll?timeout=").append(timeoutSeconds)
                .append("&limit=").append(batchSize);
        cursor.ifPresent(value -> url.append("&cursor=").append(URLEncoder.encode(value.value(), StandardCharsets.UTF_8)));
        return URI.create(url.toString());
    }

    private EventBatch toBatch(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            credentials.invalidate();
            throw new TransportException(ErrorKind.AUTH, "인증 실패 status=" + status);
        }
        if (status == 429) {
            throw new TransportException(ErrorKind.RATE_LIMITED, "요청 한도 초과 status=429", retryAfter(response).orElse(null));
        }
        if (status >= 500) {
            throw new TransportException(ErrorKind.SERVER, "서버 오류 status=" + status);
        }
        if (status >= 400) {
            log.warnf("롱폴링 요청 거부 status=%d body=%s", status, response.body());
            throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "요청이 거부되었습니다 status=" + status);
        }
        PollResponse body;
        try {
            body = objectMapper.readValue(response.body(), PollResponse.class);
        } catch (JsonProcessingException e) {
            throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "응답 본문을 해석할 수 없습니다: " + e.getOriginalMessage(), e);
        }
        if (body == null || body.nextCursor() == null || body.nextCursor().isEmpty()) {
            throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "응답에 next_cursor가 없습니다.");
        }
        List<RawEvent> events = Optional.ofNullable(body.events())
                .orElse(List.of())
                .stream()
                .map(this::toRawEvent)
                .toList();
        return new EventBatch(events, new Cursor(body.nextCursor()));
    }

    private RawEvent toRawEvent(PolledEvent event) {
        if (event == null || event.id() == null || event.id().isBlank() || event.type() == null) {
            throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "이벤트에 id/type이 없습니다.");
        }
        Instant occurredAt = null;
        if (event.occurredAt() != null) {
            try {
                occurredAt = Instant.parse(event.occurredAt());
            } catch (DateTimeParseException e) {
                throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "이벤트 시각 형식이 올바르지 않습니다: " + event.occurredAt(), e);
            }
        }
        String payload = event.data() == null ? "null" : event.data().toString();
        return new RawEvent(event.id(), event.type(), occurredAt, payload);
    }

    /**
     * 초 단위 Retry-After 만 해석한다. 해석할 수 없는 값은 없는 것으로 취급한다.
     */
    private Optional<Duration> retryAfter(HttpResponse<String> response) {
        Optional<String> header = response.headers().firstValue("Retry-After")
                .map(String::trim)
                .filter(value -> !value.isEmpty() && value.chars().allMatch(Character::isDigit));
        if (header.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Duration.ofSeconds(Long.parseLong(header.get())));
        } catch (NumberFormatException e) {
            log.warnf("Retry-After 값을 해석할 수 없어 무시합니다: value=%s", header.get());
            return Optional.empty();
        }
    }

    private String trimTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PollResponse(@JsonProperty("events") List<PolledEvent> events,
                                @JsonProperty("next_cursor") String nextCursor) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record PolledEvent(@JsonProperty("id") String id,
                               @JsonProperty("type") String type,
                               @JsonProperty("occurred_at") String occurredAt,
                               @JsonProperty("data") JsonNode data) {
    }
}
