package com.my.callsync.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    GoogleConfig google();

    StorageConfig storage();

    LeaseConfig lease();

    AvailabilityConfig availability();

    interface GoogleConfig {
        @WithName("client-id")
        Optional<String> clientId();

        @WithName("client-secret")
        Optional<String> clientSecret();

        @WithName("redirect-uri")
        @WithDefault("http://localhost:8080/gcal/oauth-callback")
        String redirectUri();

        @WithName("application-name")
        @WithDefault("call-sync-worker")
        String applicationName();

        @WithName("max-results")
        @WithDefault("250")
        int maxResults();

        @WithName("refresh-skew-seconds")
        @WithDefault("60")
        int refreshSkewSeconds();
    }

    interface StorageConfig {
        @WithName("sqlite-path")
        @WithDefault("./data/call-sync.db")
        String sqlitePath();
    }

    interface LeaseConfig {
        @WithName("backend")
        @WithDefault("sqlite")
        String backend();

        @WithName("ttl-seconds")
        @WithDefault("120")
        int ttlSeconds();

        @WithName("wait-millis")
        @WithDefault("10000")
        long waitMillis();
    }

    interface AvailabilityConfig {
        @WithName("start-hour")
        @WithDefault("9")
        int startHour();

        @WithName("end-hour")
        @WithDefault("22")
        int endHour();

        @WithName("utc-offset-hours")
        @WithDefault("-5")
        int utcOffsetHours();

        @WithName("zone-label")
        @WithDefault("ET")
        String zoneLabel();

        @WithName("target-weekdays")
        @WithDefault("5")
        int targetWeekdays();

        @WithName("max-scan-days")
        @WithDefault("14")
        int maxScanDays();

        @WithName("lookahead-days")
        @WithDefault("14")
        int lookaheadDays();
    }
}
