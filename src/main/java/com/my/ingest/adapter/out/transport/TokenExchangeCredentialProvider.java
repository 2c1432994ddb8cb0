package com.my.ingest.adapter.out.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.ingest.domain.exception.TransportException;
import com.my.ingest.domain.model.ErrorKind;
import com.my.ingest.domain.port.out.ClockPort;
import com.my.ingest.domain.port.out.CredentialPort;
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
import java.util.concurrent.CancellationException;

/**
 * 왜: client credentials 로 발급받는 단기 토큰을 만료 직전까지 재사용해 매 폴링마다 토큰 교환을 하지 않기 위함.
 *
 * <p>서버가 토큰을 거부하면 {@link #invalidate()}로 캐시를 비워 다음 호출에서 다시 교환한다.
 */
public class TokenExchangeCredentialProvider implements CredentialPort {

    private static final Logger log = Logger.getLogger(TokenExchangeCredentialProvider.class);
    private static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final URI tokenUri;
    private final String clientId;
    private final String clientSecret;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ClockPort clockPort;

    private String cachedToken;
    private Instant expiresAt;

    public TokenExchangeCredentialProvider(URI tokenUri,
                                           String clientId,
                                           String clientSecret,
                                           HttpClient httpClient,
                                           ObjectMapper objectMapper,
                                           ClockPort clockPort) {
        this.tokenUri = tokenUri;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clockPort = clockPort;
    }

    @Override
    public synchronized String bearerToken() {
        Instant now = clockPort.now();
        if (cachedToken != null && now.isBefore(expiresAt)) {
            return cachedToken;
        }
        TokenResponse token = exchange();
        long expiresIn = token.expiresIn() == null ? DEFAULT_EXPIRES_IN_SECONDS : token.expiresIn();
        cachedToken = token.accessToken();
        expiresAt = now.plusSeconds(Math.max(0, expiresIn - EXPIRY_SKEW.getSeconds()));
        log.debugf("토큰을 새로 발급받았습니다: expiresAt=%s", expiresAt);
        return cachedToken;
    }

    @Override
    public synchronized void invalidate() {
        cachedToken = null;
        expiresAt = null;
    }

    private TokenResponse exchange() {
        String form = "grant_type=client_credentials"
                + "&client_id=" + URLEncoder.encode(clientId, StandardCharsets.UTF_8)
                + "&client_secret=" + URLEncoder.encode(clientSecret, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(tokenUri)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(ErrorKind.NETWORK, "토큰 교환 요청 실패: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("토큰 교환 요청이 중단되었습니다.");
        }
        int status = response.statusCode();
        if (status == 400 || status == 401 || status == 403) {
            throw new TransportException(ErrorKind.AUTH, "토큰 교환이 거부되었습니다 status=" + status);
        }
        if (status == 429) {
            throw new TransportException(ErrorKind.RATE_LIMITED, "토큰 교환 요청 한도 초과 status=429");
        }
        if (status >= 500) {
            throw new TransportException(ErrorKind.SERVER, "토큰 서버 오류 status=" + status);
        }
        if (status >= 400) {
            throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "토큰 교환 요청 실패 status=" + status);
        }
        try {
            TokenResponse token = objectMapper.readValue(response.body(), TokenResponse.class);
            if (token == null || token.accessToken() == null || token.accessToken().isBlank()) {
                throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "토큰 응답에 access_token이 없습니다.");
            }
            return token;
        } catch (JsonProcessingException e) {
            throw new TransportException(ErrorKind.MALFORMED_RESPONSE, "토큰 응답을 해석할 수 없습니다: " + e.getOriginalMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record TokenResponse(@JsonProperty("access_token") String accessToken,
                                 @JsonProperty("expires_in") Long expiresIn) {
    }
}
