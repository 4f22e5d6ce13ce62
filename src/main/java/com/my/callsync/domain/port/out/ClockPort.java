package com.my.callsync.domain.port.out;

import java.time.Instant;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 토큰 만료 판정과 테스트 가능성을 확보하기 위함.
 */
public interface ClockPort {
    Instant now();
}
