package com.my.callsync.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 왜: 일정 처리 시 시작/종료 시각을 하나의 절대 시간축(UTC Instant)으로 묶어 검증하고 전달하기 위함.
 */
public record TimeRange(Instant start, Instant end) {
    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("종료 시간이 시작 시간보다 이를 수 없습니다.");
        }
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
