package com.my.callsync.adapter.out.lease;

import com.my.callsync.config.AppConfig;
import com.my.callsync.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;

/**
 * 왜: 여러 워커 인스턴스가 같은 SQLite 파일을 공유할 때도 사용자 단위 작업이 겹치지 않게 하기 위함.
 * <p>
 * 획득은 단일 UPSERT 문으로 판정한다. 기존 행이 만료된 경우에만 덮어쓰므로 변경 행 수가 곧 획득 여부다.
 */
@IfBuildProperty(name = "app.lease.backend", stringValue = "sqlite", enableIfMissing = true)
@ApplicationScoped
public class SqliteUserLease extends PollingUserLease {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS user_leases (
                lease_key TEXT PRIMARY KEY,
                holder TEXT NOT NULL,
                expires_at INTEGER NOT NULL
            )
            """;

    private static final String ACQUIRE_SQL = """
            INSERT INTO user_leases(lease_key, holder, expires_at) VALUES (?, ?, ?)
            ON CONFLICT(lease_key) DO UPDATE SET holder = excluded.holder, expires_at = excluded.expires_at
            WHERE user_leases.expires_at <= ?
            """;
    private static final String RELEASE_SQL = "DELETE FROM user_leases WHERE lease_key = ? AND holder = ?";

    private final DataSource dataSource;

    @Inject
    public SqliteUserLease(DataSource dataSource, AppConfig appConfig, ClockPort clock) {
        this(dataSource, appConfig.lease(), clock);
    }

    SqliteUserLease(DataSource dataSource, AppConfig.LeaseConfig leaseConfig, ClockPort clock) {
        super(clock, Duration.ofSeconds(leaseConfig.ttlSeconds()), Duration.ofMillis(leaseConfig.waitMillis()));
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("리스 테이블 초기화 실패", e);
        }
    }

    @Override
    protected boolean tryAcquire(String leaseKey, String holder, Instant now, Instant expiresAt) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(ACQUIRE_SQL)) {
            ps.setString(1, leaseKey);
            ps.setString(2, holder);
            ps.setLong(3, expiresAt.toEpochMilli());
            ps.setLong(4, now.toEpochMilli());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("리스 획득 실패: " + leaseKey, e);
        }
    }

    @Override
    protected void release(String leaseKey, String holder) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(RELEASE_SQL)) {
            ps.setString(1, leaseKey);
            ps.setString(2, holder);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("리스 해제 실패: " + leaseKey, e);
        }
    }
}
