package com.my.callsync.domain.model;

import com.my.callsync.domain.exception.InvalidRequestException;

import java.time.ZoneOffset;
import java.util.Objects;

/**
 * 근무 시간 정책. 시간대는 고정 UTC 오프셋이며 일광 절약 시간 규칙은 적용하지 않는다.
 */
public record WorkHourPolicy(int startHour, int endHour, ZoneOffset utcOffset, String zoneLabel) {
    public WorkHourPolicy {
        Objects.requireNonNull(utcOffset, "utcOffset");
        if (startHour < 0 || endHour > 24 || startHour >= endHour) {
            throw new InvalidRequestException("근무 시간 범위가 올바르지 않습니다: " + startHour + "-" + endHour);
        }
        zoneLabel = zoneLabel == null ? "" : zoneLabel.trim();
    }

    public int slotCount() {
        return endHour - startHour;
    }
}
