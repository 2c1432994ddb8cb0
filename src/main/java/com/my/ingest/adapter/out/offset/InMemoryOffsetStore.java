package com.my.ingest.adapter.out.offset;

import com.my.ingest.domain.model.OffsetRecord;
import com.my.ingest.domain.port.out.OffsetStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 왜: 개발/테스트 환경에서 외부 저장소 없이 커서 저장 계약을 만족시키기 위함. 프로세스가 끝나면 커서도 사라진다.
 */
@IfBuildProperty(name = "app.offset-store.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryOffsetStore implements OffsetStorePort {

    private static final Logger log = Logger.getLogger(InMemoryOffsetStore.class);

    private final Map<String, OffsetRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<OffsetRecord> readCursor(String accountId) {
        OffsetRecord record = records.get(accountId);
        if (record == null) {
            return Optional.empty();
        }
        if (!record.isCurrentSchema()) {
            log.warnf("스키마 버전이 달라 커서를 무시합니다: account=%s version=%d", accountId, record.schemaVersion());
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public void writeCursor(OffsetRecord record) {
        records.put(record.accountId(), record);
    }

    @Override
    public void deleteCursor(String accountId) {
        records.remove(accountId);
    }
}
