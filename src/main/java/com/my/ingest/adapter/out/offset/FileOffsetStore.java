package com.my.ingest.adapter.out.offset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.ingest.config.AppConfig;
import com.my.ingest.domain.exception.OffsetStoreException;
import com.my.ingest.domain.model.Cursor;
import com.my.ingest.domain.model.OffsetRecord;
import com.my.ingest.domain.port.out.OffsetStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: DB 없이도 재시작 후 커서를 이어받을 수 있도록 계정별 JSON 파일에 커서를 보관한다.
 *
 * <p>임시 파일에 쓰고 fsync 한 뒤 원자적으로 교체하므로 읽는 쪽은 이전 레코드 또는 새 레코드만 본다.
 * 여러 프로세스가 같은 계정을 쓰면 마지막에 교체한 쪽이 남는다.
 */
@IfBuildProperty(name = "app.offset-store.backend", stringValue = "file")
@ApplicationScoped
public class FileOffsetStore implements OffsetStorePort {

    private static final Logger log = Logger.getLogger(FileOffsetStore.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileOffsetStore(AppConfig appConfig, ObjectMapper objectMapper) {
        this.directory = Path.of(appConfig.offsetStore().path());
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new OffsetStoreException("커서 디렉터리 초기화 실패: " + directory, e);
        }
    }

    @Override
    public Optional<OffsetRecord> readCursor(String accountId) {
        Path file = fileFor(accountId);
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new OffsetStoreException("커서 파일 조회 실패: " + file, e);
        }
        StoredOffset stored;
        try {
            stored = objectMapper.readValue(content, StoredOffset.class);
        } catch (IOException e) {
            log.warnf("커서 파일을 해석할 수 없어 없는 것으로 취급합니다: file=%s cause=%s", file, e.getMessage());
            return Optional.empty();
        }
        if (stored.schemaVersion() != OffsetRecord.SCHEMA_VERSION) {
            log.warnf("스키마 버전이 달라 커서를 무시합니다: account=%s version=%d", accountId, stored.schemaVersion());
            return Optional.empty();
        }
        if (stored.cursor() == null || stored.cursor().isEmpty()) {
            log.warnf("커서 값이 비어 있어 무시합니다: account=%s file=%s", accountId, file);
            return Optional.empty();
        }
        return Optional.of(stored.toRecord(accountId));
    }

    @Override
    public void writeCursor(OffsetRecord record) {
        Path target = fileFor(record.accountId());
        Path temp = null;
        try {
            byte[] content = objectMapper.writeValueAsBytes(StoredOffset.from(record));
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            forceDirectory();
        } catch (JsonProcessingException e) {
            throw new OffsetStoreException("커서 직렬화 실패: account=" + record.accountId(), e);
        } catch (IOException e) {
            OffsetStoreException failure = new OffsetStoreException("커서 파일 기록 실패: " + target, e);
            deleteTemp(temp, failure);
            throw failure;
        }
    }

    @Override
    public void deleteCursor(String accountId) {
        try {
            Files.deleteIfExists(fileFor(accountId));
        } catch (IOException e) {
            throw new OffsetStoreException("커서 파일 삭제 실패: account=" + accountId, e);
        }
    }

    Path fileFor(String accountId) {
        return directory.resolve(URLEncoder.encode(accountId, StandardCharsets.UTF_8) + SUFFIX);
    }

    private void forceDirectory() {
        // 디렉터리 fsync 는 일부 플랫폼(Windows)에서 지원되지 않는다.
        try (FileChannel dir = FileChannel.open(directory, StandardOpenOption.READ)) {
            dir.force(true);
        } catch (IOException e) {
            log.debugf("디렉터리 동기화를 건너뜁니다: dir=%s cause=%s", directory, e.getMessage());
        }
    }

    private void deleteTemp(Path temp, OffsetStoreException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException suppressed) {
            failure.addSuppressed(suppressed);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record StoredOffset(String accountId, String cursor, Long lastEventTimeMillis, int schemaVersion) {

        static StoredOffset from(OffsetRecord record) {
            Long eventTime = record.lastEventTime() == null ? null : record.lastEventTime().toEpochMilli();
            return new StoredOffset(record.accountId(), record.cursor().value(), eventTime, record.schemaVersion());
        }

        OffsetRecord toRecord(String accountId) {
            Instant eventTime = lastEventTimeMillis == null ? null : Instant.ofEpochMilli(lastEventTimeMillis);
            return new OffsetRecord(accountId, new Cursor(cursor), eventTime, schemaVersion);
        }
    }
}
