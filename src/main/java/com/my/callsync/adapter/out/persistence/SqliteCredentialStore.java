package com.my.callsync.adapter.out.persistence;

import com.my.callsync.domain.model.OAuthCredential;
import com.my.callsync.domain.port.out.CredentialStorePort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Optional;

/**
 * 왜: 사용자당 한 행의 OAuth 자격 증명을 재시작 이후에도 유지하고, 갱신 시 같은 행을 제자리에서 덮어쓰기 위함.
 */
@ApplicationScoped
public class SqliteCredentialStore implements CredentialStorePort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS oauth_credentials (
                user_id TEXT PRIMARY KEY,
                access_token TEXT NOT NULL,
                refresh_token TEXT NOT NULL,
                expires_at INTEGER NOT NULL,
                calendar_id TEXT NOT NULL DEFAULT 'primary',
                updated_at INTEGER NOT NULL
            )
            """;

    private static final String SELECT_SQL = """
            SELECT user_id, access_token, refresh_token, expires_at, calendar_id
            FROM oauth_credentials WHERE user_id = ?
            """;
    private static final String UPSERT_SQL = """
            INSERT INTO oauth_credentials(user_id, access_token, refresh_token, expires_at, calendar_id, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(user_id) DO UPDATE SET
                access_token = excluded.access_token,
                refresh_token = excluded.refresh_token,
                expires_at = excluded.expires_at,
                calendar_id = excluded.calendar_id,
                updated_at = excluded.updated_at
            """;
    private static final String DELETE_SQL = "DELETE FROM oauth_credentials WHERE user_id = ?";

    private final DataSource dataSource;

    public SqliteCredentialStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<OAuthCredential> find(String userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new OAuthCredential(
                        rs.getString("user_id"),
                        rs.getString("access_token"),
                        rs.getString("refresh_token"),
                        Instant.ofEpochMilli(rs.getLong("expires_at")),
                        rs.getString("calendar_id")
                ));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 조회 실패", e);
        }
    }

    @Override
    public void save(OAuthCredential credential) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, credential.userId());
            ps.setString(2, credential.accessToken());
            ps.setString(3, credential.refreshToken());
            ps.setLong(4, credential.expiresAt().toEpochMilli());
            ps.setString(5, credential.calendarId());
            ps.setLong(6, Instant.now().toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 저장 실패", e);
        }
    }

    @Override
    public boolean delete(String userId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, userId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("자격 증명 삭제 실패", e);
        }
    }
}
