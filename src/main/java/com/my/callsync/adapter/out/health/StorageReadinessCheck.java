package com.my.callsync.adapter.out.health;

import com.my.callsync.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

@Readiness
@ApplicationScoped
public class StorageReadinessCheck implements HealthCheck {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final AppConfig appConfig;

    public StorageReadinessCheck(DataSource dataSource, AppConfig appConfig) {
        this.dataSource = dataSource;
        this.appConfig = appConfig;
    }

    @Override
    public HealthCheckResponse call() {
        boolean storageOk;
        String error = null;
        try (Connection conn = dataSource.getConnection()) {
            storageOk = conn.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            storageOk = false;
            error = e.getMessage();
        }
        var builder = HealthCheckResponse.named("call-sync-storage")
                .withData("sqlitePath", appConfig.storage().sqlitePath())
                .withData("storageReachable", storageOk);
        if (error != null) {
            builder.withData("error", error);
        }
        return builder.status(storageOk).build();
    }
}
