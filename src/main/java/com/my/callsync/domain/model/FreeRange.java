package com.my.callsync.domain.model;

public record FreeRange(int startHour, int endHour) {
    public FreeRange {
        if (startHour >= endHour) {
            throw new IllegalArgumentException("빈 구간의 시작이 종료보다 늦을 수 없습니다.");
        }
    }
}
