package com.my.ingest.domain.port.out;

/**
 * 왜: 전송 계층이 사용할 Bearer 자격 증명 획득 방식을 교체 가능하게 분리하기 위함.
 *
 * <p>획득 실패는 {@link com.my.ingest.domain.exception.TransportException}으로 던진다.
 */
public interface CredentialPort {

    String bearerToken();

    /**
     * 서버가 자격 증명을 거부했을 때 호출되어 캐시된 값을 버린다.
     */
    default void invalidate() {
    }
}
