package com.my.callsync.domain.model;

import java.time.Instant;
import java.util.Objects;

public record BusyInterval(Instant start, Instant end) {
    public BusyInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    /**
     * 반열린 구간 겹침 판정: {@code start < slotEnd && end > slotStart}.
     */
    public boolean overlaps(Instant slotStart, Instant slotEnd) {
        return start.isBefore(slotEnd) && end.isAfter(slotStart);
    }

    public static BusyInterval of(ExternalEvent event) {
        return new BusyInterval(event.timeRange().start(), event.timeRange().end());
    }
}
