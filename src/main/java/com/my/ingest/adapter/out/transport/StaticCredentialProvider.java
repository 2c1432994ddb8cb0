package com.my.ingest.adapter.out.transport;

import com.my.ingest.domain.port.out.CredentialPort;

import java.util.Objects;

/**
 * 왜: 장기 토큰을 발급받아 쓰는 계정을 위해 설정된 Bearer 토큰을 그대로 제공하기 위함.
 */
public class StaticCredentialProvider implements CredentialPort {

    private final String token;

    public StaticCredentialProvider(String token) {
        Objects.requireNonNull(token, "token");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token은 비어 있을 수 없습니다.");
        }
        this.token = token;
    }

    @Override
    public String bearerToken() {
        return token;
    }
}
