package com.my.callsync.adapter.out.clock;

import com.my.callsync.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;

/**
 * 왜: 시스템 시간을 포트 뒤로 숨겨 도메인 서비스가 시계를 주입받도록 하기 위함.
 */
public class SystemClockAdapter implements ClockPort {

    private final Clock clock;

    private SystemClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static SystemClockAdapter system() {
        return new SystemClockAdapter(Clock.systemUTC());
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
