package com.my.callsync.adapter.out.persistence;

import com.my.callsync.domain.model.Contact;
import com.my.callsync.domain.model.ContactStage;
import com.my.callsync.domain.model.NewContact;
import com.my.callsync.domain.port.out.ContactDirectoryPort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 연락처 협력자 계약의 SQLite 구현. 이메일 조회, 생성, 단계 전진만 제공한다.
 */
@ApplicationScoped
public class SqliteContactDirectory implements ContactDirectoryPort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS contacts (
                id TEXT PRIMARY KEY,
                user_id TEXT NOT NULL,
                name TEXT NOT NULL,
                email TEXT,
                email_lower TEXT,
                firm TEXT,
                position TEXT,
                connection_type TEXT NOT NULL,
                stage TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """;
    private static final String INDEX_DDL =
            "CREATE INDEX IF NOT EXISTS idx_contacts_user_email ON contacts(user_id, email_lower)";

    private static final String SELECT_BY_EMAIL_SQL = """
            SELECT * FROM contacts WHERE user_id = ? AND email_lower = ? ORDER BY created_at LIMIT 1
            """;
    private static final String SELECT_BY_ID_SQL = "SELECT * FROM contacts WHERE id = ? AND user_id = ?";
    private static final String INSERT_SQL = """
            INSERT INTO contacts(id, user_id, name, email, email_lower, firm, position, connection_type, stage, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
    private static final String ADVANCE_SQL_PREFIX = "UPDATE contacts SET stage = ? WHERE id = ? AND user_id = ? AND stage IN ";

    private final DataSource dataSource;

    public SqliteContactDirectory(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
            stmt.execute(INDEX_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("연락처 테이블 초기화 실패", e);
        }
    }

    @Override
    public Optional<Contact> findByEmail(String userId, String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_EMAIL_SQL)) {
            ps.setString(1, userId);
            ps.setString(2, normalize(email));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("연락처 이메일 조회 실패", e);
        }
    }

    @Override
    public Optional<Contact> findById(String userId, String contactId) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            ps.setString(1, contactId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("연락처 조회 실패", e);
        }
    }

    @Override
    public Contact create(String userId, NewContact contact) {
        String id = UUID.randomUUID().toString();
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setString(1, id);
            ps.setString(2, userId);
            ps.setString(3, contact.name());
            ps.setString(4, contact.email());
            ps.setString(5, normalize(contact.email()));
            ps.setString(6, contact.firm());
            ps.setString(7, contact.position());
            ps.setString(8, contact.connectionType().name());
            ps.setString(9, contact.stage().name());
            ps.setLong(10, Instant.now().toEpochMilli());
            ps.executeUpdate();
            return new Contact(id, userId, contact.name(), contact.email(), contact.firm(), contact.position(), contact.stage());
        } catch (SQLException e) {
            throw new IllegalStateException("연락처 생성 실패: " + contact.email(), e);
        }
    }

    @Override
    public boolean advanceStage(String userId, String contactId, ContactStage target) {
        List<ContactStage> earlier = Arrays.stream(ContactStage.values())
                .filter(stage -> stage.precedes(target))
                .toList();
        if (earlier.isEmpty()) {
            return false;
        }
        String placeholders = earlier.stream().map(stage -> "?").collect(Collectors.joining(", ", "(", ")"));
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(ADVANCE_SQL_PREFIX + placeholders)) {
            ps.setString(1, target.name());
            ps.setString(2, contactId);
            ps.setString(3, userId);
            for (int i = 0; i < earlier.size(); i++) {
                ps.setString(4 + i, earlier.get(i).name());
            }
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("연락처 단계 갱신 실패", e);
        }
    }

    // SQLite lower()는 ASCII만 접으므로 비교용 값은 Java에서 만든다
    private static String normalize(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private Contact map(ResultSet rs) throws SQLException {
        return new Contact(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("name"),
                rs.getString("email"),
                rs.getString("firm"),
                rs.getString("position"),
                ContactStage.valueOf(rs.getString("stage"))
        );
    }
}
