package com.my.callsync.adapter.out.lease;

import com.my.callsync.config.AppConfig;
import com.my.callsync.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 단일 프로세스용 리스. 프로세스 재시작 시 모든 리스가 사라진다.
 */
@IfBuildProperty(name = "app.lease.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryUserLease extends PollingUserLease {

    private final Map<String, Holder> leases = new ConcurrentHashMap<>();

    @Inject
    public InMemoryUserLease(AppConfig appConfig, ClockPort clock) {
        this(appConfig.lease(), clock);
    }

    InMemoryUserLease(AppConfig.LeaseConfig leaseConfig, ClockPort clock) {
        super(clock, Duration.ofSeconds(leaseConfig.ttlSeconds()), Duration.ofMillis(leaseConfig.waitMillis()));
    }

    @Override
    protected boolean tryAcquire(String leaseKey, String holder, Instant now, Instant expiresAt) {
        Holder candidate = new Holder(holder, expiresAt);
        Holder current = leases.compute(leaseKey, (key, existing) ->
                existing == null || !existing.expiresAt().isAfter(now) ? candidate : existing);
        return current == candidate;
    }

    @Override
    protected void release(String leaseKey, String holder) {
        leases.computeIfPresent(leaseKey, (key, existing) -> existing.holder().equals(holder) ? null : existing);
    }

    private record Holder(String holder, Instant expiresAt) {
    }
}
