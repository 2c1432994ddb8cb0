package com.my.ingest.domain.port.out;

import com.my.ingest.domain.model.OffsetRecord;

import java.util.Optional;

/**
 * 왜: 계정별 커서를 내구성 있게 보관해 재시작 후에도 처리 위치를 잃지 않도록 하기 위함.
 *
 * <p>구현 규칙:
 * <ul>
 *   <li>스키마 버전이 다른 레코드는 없는 것으로 취급한다.</li>
 *   <li>{@link #writeCursor(OffsetRecord)}는 반환 전에 내구성 있게 기록되어야 하며 읽는 쪽에서 부분 기록이 보이면 안 된다.</li>
 *   <li>서로 다른 계정에 대한 동시 호출에 안전해야 한다.</li>
 * </ul>
 * 저장소 장애는 {@link com.my.ingest.domain.exception.OffsetStoreException}으로 던진다.
 */
public interface OffsetStorePort {

    Optional<OffsetRecord> readCursor(String accountId);

    void writeCursor(OffsetRecord record);

    void deleteCursor(String accountId);
}
