package com.my.ingest.adapter.out.offset;

import com.my.ingest.config.AppConfig;
import com.my.ingest.domain.exception.OffsetStoreException;
import com.my.ingest.domain.model.Cursor;
import com.my.ingest.domain.model.OffsetRecord;
import com.my.ingest.domain.port.out.OffsetStorePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 단일 호스트 배포에서 재시작 후에도 계정별 커서를 잃지 않도록 파일 기반 SQLite에 보관한다.
 */
@IfBuildProperty(name = "app.offset-store.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteOffsetStore implements OffsetStorePort {

    private static final Logger log = Logger.getLogger(SqliteOffsetStore.class);

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS offset_record (
                account_id TEXT PRIMARY KEY,
                cursor TEXT NOT NULL,
                last_event_time INTEGER,
                schema_version INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO offset_record(account_id, cursor, last_event_time, schema_version, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(account_id) DO UPDATE SET
                cursor = excluded.cursor,
                last_event_time = excluded.last_event_time,
                schema_version = excluded.schema_version,
                updated_at = excluded.updated_at
            """;
    private static final String SELECT_SQL = "SELECT cursor, last_event_time, schema_version FROM offset_record WHERE account_id = ?";
    private static final String DELETE_SQL = "DELETE FROM offset_record WHERE account_id = ?";
    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private final DataSource dataSource;
    private final Path sqlitePath;

    public SqliteOffsetStore(DataSource dataSource, AppConfig appConfig) {
        this.dataSource = dataSource;
        this.sqlitePath = Path.of(appConfig.offsetStore().sqlitePath());
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new OffsetStoreException("SQLite 경로 생성 실패", e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new OffsetStoreException("커서 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<OffsetRecord> readCursor(String accountId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, accountId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                int schemaVersion = rs.getInt("schema_version");
                if (schemaVersion != OffsetRecord.SCHEMA_VERSION) {
                    log.warnf("스키마 버전이 달라 커서를 무시합니다: account=%s version=%d", accountId, schemaVersion);
                    return Optional.empty();
                }
                long eventTime = rs.getLong("last_event_time");
                Instant lastEventTime = rs.wasNull() ? null : Instant.ofEpochMilli(eventTime);
                return Optional.of(new OffsetRecord(accountId, new Cursor(rs.getString("cursor")), lastEventTime, schemaVersion));
            }
        } catch (SQLException e) {
            throw new OffsetStoreException("커서 조회 실패: account=" + accountId, e);
        }
    }

    @Override
    public void writeCursor(OffsetRecord record) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, record.accountId());
            ps.setString(2, record.cursor().value());
            if (record.lastEventTime() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setLong(3, record.lastEventTime().toEpochMilli());
            }
            ps.setInt(4, record.schemaVersion());
            ps.setLong(5, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new OffsetStoreException("커서 기록 실패: account=" + record.accountId(), e);
        }
    }

    @Override
    public void deleteCursor(String accountId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, accountId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new OffsetStoreException("커서 삭제 실패: account=" + accountId, e);
        }
    }
}
