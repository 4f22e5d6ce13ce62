package com.my.callsync.adapter.out.lease;

import com.my.callsync.adapter.out.clock.SystemClockAdapter;
import com.my.callsync.config.AppConfig;
import com.my.callsync.domain.exception.LeaseUnavailableException;
import com.my.callsync.domain.port.out.UserLeasePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteUserLeaseTest {

    @TempDir
    Path tempDir;

    private SQLiteDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("call-sync.db").toAbsolutePath());
    }

    @Test
    void second_holder_waits_then_gives_up() {
        SqliteUserLease first = lease(120, 0);
        SqliteUserLease second = lease(120, 150);

        try (UserLeasePort.Lease held = first.acquire("sync:user-1")) {
            assertThat(held.key()).isEqualTo("sync:user-1");
            assertThatThrownBy(() -> second.acquire("sync:user-1"))
                    .isInstanceOf(LeaseUnavailableException.class);
            try (UserLeasePort.Lease other = second.acquire("sync:user-2")) {
                assertThat(other.key()).isEqualTo("sync:user-2");
            }
        }

        try (UserLeasePort.Lease reacquired = second.acquire("sync:user-1")) {
            assertThat(reacquired.key()).isEqualTo("sync:user-1");
        }
    }

    @Test
    void expired_lease_is_reclaimed() throws Exception {
        SqliteUserLease crashed = lease(120, 0);
        crashed.acquire("refresh:user-1");
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("UPDATE user_leases SET expires_at = ? WHERE lease_key = ?")) {
            ps.setLong(1, System.currentTimeMillis() - 1000);
            ps.setString(2, "refresh:user-1");
            ps.executeUpdate();
        }

        try (UserLeasePort.Lease held = lease(120, 0).acquire("refresh:user-1")) {
            assertThat(held.key()).isEqualTo("refresh:user-1");
        }
    }

    @Test
    void stale_holder_release_does_not_drop_new_holder() throws Exception {
        SqliteUserLease stale = lease(120, 0);
        UserLeasePort.Lease old = stale.acquire("sync:user-1");
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("UPDATE user_leases SET expires_at = 0")) {
            ps.executeUpdate();
        }
        SqliteUserLease current = lease(120, 0);
        UserLeasePort.Lease fresh = current.acquire("sync:user-1");

        old.close();

        assertThatThrownBy(() -> lease(120, 0).acquire("sync:user-1"))
                .isInstanceOf(LeaseUnavailableException.class);
        fresh.close();
    }

    private SqliteUserLease lease(int ttlSeconds, long waitMillis) {
        SqliteUserLease lease = new SqliteUserLease(dataSource, new StubLeaseConfig(ttlSeconds, waitMillis),
                SystemClockAdapter.system());
        lease.init();
        return lease;
    }

    static final class StubLeaseConfig implements AppConfig.LeaseConfig {
        private final int ttlSeconds;
        private final long waitMillis;

        StubLeaseConfig(int ttlSeconds, long waitMillis) {
            this.ttlSeconds = ttlSeconds;
            this.waitMillis = waitMillis;
        }

        @Override
        public String backend() {
            return "sqlite";
        }

        @Override
        public int ttlSeconds() {
            return ttlSeconds;
        }

        @Override
        public long waitMillis() {
            return waitMillis;
        }
    }
}
