package com.my.callsync.adapter.out.persistence;

import com.my.callsync.domain.model.CallStatus;
import com.my.callsync.domain.model.LocalCallRecord;
import com.my.callsync.domain.model.TimeRange;
import com.my.callsync.domain.port.out.CallRecordStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 왜: (user_id, external_provider, external_event_id) 유일성 제약으로 외부 이벤트가 두 번 미러링되는 것을 저장소 수준에서 막기 위함.
 * <p>
 * SQLite의 UNIQUE는 NULL을 서로 다른 값으로 취급하므로 외부 참조가 없는 기록은 제약에 걸리지 않는다.
 */
@ApplicationScoped
public class SqliteCallRecordStore implements CallRecordStorePort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS call_records (
                id TEXT PRIMARY KEY,
                user_id TEXT NOT NULL,
                contact_id TEXT,
                title TEXT NOT NULL,
                start_at INTEGER NOT NULL,
                end_at INTEGER NOT NULL,
                location TEXT,
                notes TEXT,
                status TEXT NOT NULL,
                external_provider TEXT,
                external_event_id TEXT,
                UNIQUE (user_id, external_provider, external_event_id)
            )
            """;

    private static final String INSERT_SQL = """
            INSERT OR IGNORE INTO call_records(id, user_id, contact_id, title, start_at, end_at, location, notes,
                                               status, external_provider, external_event_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String SELECT_BY_ID_SQL = "SELECT * FROM call_records WHERE id = ? AND user_id = ?";
    private static final String SELECT_EXTERNAL_IDS_SQL = """
            SELECT external_event_id FROM call_records
            WHERE user_id = ? AND external_provider = ? AND external_event_id IS NOT NULL
            """;
    private static final String UPDATE_EXTERNAL_SQL = """
            UPDATE call_records SET external_provider = ?, external_event_id = ? WHERE id = ? AND user_id = ?
            """;

    private final DataSource dataSource;

    public SqliteCallRecordStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("통화 기록 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<LocalCallRecord> findById(String userId, String recordId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            ps.setString(1, recordId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("통화 기록 조회 실패", e);
        }
    }

    @Override
    public Set<String> findExternalEventIds(String userId, String provider) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_EXTERNAL_IDS_SQL)) {
            ps.setString(1, userId);
            ps.setString(2, provider);
            Set<String> ids = new HashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new IllegalStateException("미러링된 외부 이벤트 조회 실패", e);
        }
    }

    @Override
    public boolean insertIfAbsent(LocalCallRecord record) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, record.id());
            ps.setString(2, record.userId());
            ps.setString(3, record.contactId());
            ps.setString(4, record.title());
            ps.setLong(5, record.timeRange().start().toEpochMilli());
            ps.setLong(6, record.timeRange().end().toEpochMilli());
            ps.setString(7, record.location());
            ps.setString(8, record.notes());
            ps.setString(9, record.status().name());
            ps.setString(10, record.externalProvider());
            ps.setString(11, record.externalEventId());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new IllegalStateException("통화 기록 저장 실패", e);
        }
    }

    @Override
    public void updateExternalEvent(String userId, String recordId, String provider, String externalEventId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPDATE_EXTERNAL_SQL)) {
            ps.setString(1, provider);
            ps.setString(2, externalEventId);
            ps.setString(3, recordId);
            ps.setString(4, userId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("통화 기록 외부 참조 갱신 실패", e);
        }
    }

    private LocalCallRecord map(ResultSet rs) throws SQLException {
        return new LocalCallRecord(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("contact_id"),
                rs.getString("title"),
                new TimeRange(Instant.ofEpochMilli(rs.getLong("start_at")), Instant.ofEpochMilli(rs.getLong("end_at"))),
                rs.getString("location"),
                rs.getString("notes"),
                CallStatus.valueOf(rs.getString("status")),
                rs.getString("external_provider"),
                rs.getString("external_event_id")
        );
    }
}
