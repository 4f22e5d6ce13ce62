package com.my.callsync.domain.model;

import java.util.Objects;

/**
 * 외부 캘린더에 쓸 이벤트 본문. 시각은 UTC로 전송한다.
 */
public record EventDraft(String summary, String description, String location, TimeRange timeRange, String attendeeEmail) {
    public EventDraft {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(timeRange, "timeRange");
        location = location == null || location.isBlank() ? null : location;
        attendeeEmail = attendeeEmail == null || attendeeEmail.isBlank() ? null : attendeeEmail;
    }

    public boolean hasAttendee() {
        return attendeeEmail != null;
    }
}
