package com.my.callsync.adapter.out.lease;

import com.my.callsync.domain.exception.LeaseUnavailableException;
import com.my.callsync.domain.port.out.ClockPort;
import com.my.callsync.domain.port.out.UserLeasePort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * 리스 백엔드 공통 골격. 시도-대기 루프와 해제 핸들을 제공하고, 원자적 획득/해제는 하위 클래스가 맡는다.
 */
abstract class PollingUserLease implements UserLeasePort {

    private static final Logger log = Logger.getLogger(PollingUserLease.class);
    private static final long POLL_INTERVAL_MILLIS = 50;

    private final ClockPort clock;
    private final Duration ttl;
    private final Duration wait;

    protected PollingUserLease(ClockPort clock, Duration ttl, Duration wait) {
        this.clock = clock;
        this.ttl = ttl;
        this.wait = wait;
    }

    /**
     * 만료되었거나 비어 있는 리스만 차지한다. 성공 여부를 원자적으로 판정해야 한다.
     */
    protected abstract boolean tryAcquire(String leaseKey, String holder, Instant now, Instant expiresAt);

    protected abstract void release(String leaseKey, String holder);

    protected ClockPort clock() {
        return clock;
    }

    @Override
    public Lease acquire(String leaseKey) {
        String holder = UUID.randomUUID().toString();
        Instant deadline = clock.now().plus(wait);
        while (true) {
            Instant now = clock.now();
            if (tryAcquire(leaseKey, holder, now, now.plus(ttl))) {
                log.debugf("리스 획득: %s", leaseKey);
                return new HeldLease(leaseKey, holder);
            }
            if (!now.isBefore(deadline)) {
                throw new LeaseUnavailableException(leaseKey);
            }
            try {
                Thread.sleep(POLL_INTERVAL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LeaseUnavailableException(leaseKey);
            }
        }
    }

    private final class HeldLease implements Lease {
        private final String key;
        private final String holder;
        private boolean released;

        private HeldLease(String key, String holder) {
            this.key = key;
            this.holder = holder;
        }

        @Override
        public String key() {
            return key;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            release(key, holder);
            log.debugf("리스 해제: %s", key);
        }
    }
}
