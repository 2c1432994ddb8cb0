package com.my.ingest.config;

import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;

/**
 * 왜: 커서 저장 시 매 트랜잭션을 디스크에 동기화하도록 설정된 SQLite 데이터소스를 제공하기 위함.
 */
@ApplicationScoped
public class SqliteDataSourceConfig {

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "app.offset-store.backend", stringValue = "sqlite", enableIfMissing = true)
    public DataSource offsetDataSource(AppConfig appConfig) {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + Path.of(appConfig.offsetStore().sqlitePath()).toAbsolutePath());
        dataSource.setSynchronous("FULL");
        dataSource.setBusyTimeout(5000);
        return dataSource;
    }
}
