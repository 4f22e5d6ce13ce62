package com.my.callsync.config;

import io.quarkus.runtime.Startup;
import io.quarkus.runtime.LaunchMode;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("GOOGLE_CLIENT_ID", appConfig.google().clientId().orElse(null), isProd);
        validateRequired("GOOGLE_CLIENT_SECRET", appConfig.google().clientSecret().orElse(null), isProd);
        validateWorkHours(appConfig.availability(), isProd);
        if (appConfig.google().maxResults() <= 0 || appConfig.google().maxResults() > 2500) {
            fail("app.google.max-results는 1~2500 사이여야 합니다: " + appConfig.google().maxResults(), true);
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            fail("필수 설정이 비어 있습니다: " + name, strict);
        }
    }

    private void validateWorkHours(AppConfig.AvailabilityConfig availability, boolean strict) {
        int start = availability.startHour();
        int end = availability.endHour();
        if (start < 0 || end > 24 || start >= end) {
            fail("근무 시간 설정이 올바르지 않습니다: " + start + "-" + end, true);
        }
        if (availability.utcOffsetHours() < -18 || availability.utcOffsetHours() > 18) {
            fail("UTC 오프셋이 범위를 벗어났습니다: " + availability.utcOffsetHours(), true);
        }
        if (availability.targetWeekdays() > availability.maxScanDays()) {
            fail("target-weekdays가 max-scan-days보다 큽니다. 목표에 도달하지 못할 수 있습니다.", strict);
        }
    }

    private void fail(String message, boolean strict) {
        if (strict) {
            throw new IllegalStateException(message);
        }
        log.warn(message);
    }
}
