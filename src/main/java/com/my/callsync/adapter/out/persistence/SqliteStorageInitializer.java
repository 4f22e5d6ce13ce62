package com.my.callsync.adapter.out.persistence;

import com.my.callsync.config.AppConfig;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite 파일의 상위 디렉터리를 만들고 WAL 모드를 켠다. 테이블은 각 저장소가 직접 만든다.
 */
@Startup
@ApplicationScoped
public class SqliteStorageInitializer {

    private static final String ENABLE_WAL = "PRAGMA journal_mode=WAL";

    private final DataSource dataSource;
    private final Path sqlitePath;

    public SqliteStorageInitializer(DataSource dataSource, AppConfig appConfig) {
        this.dataSource = dataSource;
        this.sqlitePath = Path.of(appConfig.storage().sqlitePath());
    }

    @PostConstruct
    void init() {
        try {
            Path parent = sqlitePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (Exception e) {
            throw new IllegalStateException("SQLite 경로 생성 실패: " + sqlitePath, e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(ENABLE_WAL);
        } catch (SQLException e) {
            throw new IllegalStateException("SQLite 초기화 실패", e);
        }
    }
}
